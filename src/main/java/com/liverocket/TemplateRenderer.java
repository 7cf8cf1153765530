/*
 * Copyright 2022-2026 Revetware LLC.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.liverocket;

import org.jspecify.annotations.NonNull;

import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;

/**
 * Renders named templates for {@link Response#render(String, Map)}.
 * <p>
 * A standard threadsafe implementation that reads from a {@code templates} directory can be acquired via the
 * {@link #defaultInstance()} factory method, or pointed elsewhere via {@link #withTemplateDirectory(Path)}.
 */
public interface TemplateRenderer {
	/**
	 * Renders a template.
	 *
	 * @param templateName the template name, for example {@code index.html}
	 * @param context      values to substitute into the template
	 * @return the rendered text, or {@link Optional#empty()} if no such template exists
	 */
	@NonNull
	Optional<String> render(@NonNull String templateName,
													@NonNull Map<@NonNull String, ?> context);

	/**
	 * Describes where templates are looked up, for use in error messages.
	 *
	 * @return a human-readable location, for example an absolute directory path
	 */
	@NonNull
	String getLocationDescription();

	@NonNull
	static TemplateRenderer defaultInstance() {
		return DefaultTemplateRenderer.defaultInstance();
	}

	@NonNull
	static TemplateRenderer withTemplateDirectory(@NonNull Path templateDirectory) {
		return new DefaultTemplateRenderer(templateDirectory);
	}
}
