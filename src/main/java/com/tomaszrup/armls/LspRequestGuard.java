////////////////////////////////////////////////////////////////////////////////
// Copyright 2022 Prominic.NET, Inc.
// Copyright 2026 Tomasz Rup
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
// http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License
//
// Author: Tomasz Rup (originally Prominic.NET, Inc.)
// No warranty of merchantability or fitness of any kind.
// Use this software at your own risk.
////////////////////////////////////////////////////////////////////////////////
package com.tomaszrup.armls;

import java.net.URI;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomaszrup.armls.util.MdcDocumentContext;

/**
 * Runs template requests fail-soft. A request that throws, or whose future
 * fails, is logged and answered with its fallback value so the client never
 * sees an error response for a half-typed template. Virtual machine errors
 * still fail the request.
 */
class LspRequestGuard {
	private static final Logger logger = LoggerFactory.getLogger(LspRequestGuard.class);

	<T> CompletableFuture<T> failSoftRequest(String requestName, URI uri,
			Supplier<CompletableFuture<T>> requestCall, T fallbackValue) {
		CompletableFuture<T> future;
		try {
			future = requestCall.get();
		} catch (RuntimeException | LinkageError e) {
			logRequestFailure(requestName, uri, e);
			return CompletableFuture.completedFuture(fallbackValue);
		}
		if (future == null) {
			logger.debug("{} produced no result for {}", requestName, MdcDocumentContext.getLabel(uri));
			return CompletableFuture.completedFuture(fallbackValue);
		}
		return future.handle((result, failure) -> {
			if (failure == null) {
				return result;
			}
			Throwable cause = unwrapRequestThrowable(failure);
			if (cause instanceof VirtualMachineError) {
				throw (VirtualMachineError) cause;
			}
			logRequestFailure(requestName, uri, cause);
			return fallbackValue;
		});
	}

	private void logRequestFailure(String requestName, URI uri, Throwable failure) {
		logger.warn("{} failed for {}: {}", requestName, MdcDocumentContext.getLabel(uri),
				summarizeThrowable(failure));
		logger.debug("{} failure", requestName, failure);
	}

	/** {@code "class: message"}, or just the class name when there is no message. */
	static String summarizeThrowable(Throwable throwable) {
		if (throwable == null) {
			return "<null>";
		}
		String name = throwable.getClass().getName();
		String message = throwable.getMessage();
		return message == null || message.isBlank() ? name : name + ": " + message;
	}

	static Throwable unwrapRequestThrowable(Throwable throwable) {
		Throwable current = throwable;
		while ((current instanceof CompletionException || current instanceof ExecutionException)
				&& current.getCause() != null) {
			current = current.getCause();
		}
		return current;
	}
}
