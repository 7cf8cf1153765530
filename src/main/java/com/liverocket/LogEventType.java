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

/**
 * Kinds of {@link LogEvent} that LiveRocket emits via {@link LifecycleObserver#didReceiveLogEvent(LogEvent)}.
 */
public enum LogEventType {
	/**
	 * A middleware or route handler threw while processing a request. A {@code 500} response was sent.
	 */
	REQUEST_PROCESSING_FAILED,
	/**
	 * The bytes read from a connection could not be parsed as a request. A {@code 500} response was sent.
	 */
	SERVER_UNPARSEABLE_REQUEST,
	/**
	 * A response could not be serialized, for example because of an illegal header. A {@code 500} response was sent instead.
	 */
	RESPONSE_MARSHALING_FAILED,
	/**
	 * Reading from, writing to or closing a client connection failed.
	 */
	CONNECTION_IO_FAILED,
	/**
	 * An unexpected error occurred inside the server itself.
	 */
	SERVER_INTERNAL_ERROR,
	/**
	 * {@link LifecycleObserver#didStartRequestHandling(Request, Route)} threw an exception.
	 */
	LIFECYCLE_OBSERVER_DID_START_REQUEST_HANDLING_FAILED,
	/**
	 * {@link LifecycleObserver#didFinishRequestHandling(Request, Route, Response, java.time.Duration, java.util.List)} threw an exception.
	 */
	LIFECYCLE_OBSERVER_DID_FINISH_REQUEST_HANDLING_FAILED
}
