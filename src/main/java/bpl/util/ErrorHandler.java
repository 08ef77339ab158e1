// Copyright 2020 The Whiley Project Developers
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//    http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
package bpl.util;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.google.common.flogger.GoogleLogger;

/**
 * Accumulates the diagnostics reported whilst processing a Boogie program.
 * Passes compare the error count before and after some work to decide whether
 * that work succeeded.
 *
 */
public interface ErrorHandler {

	public void report(SyntaxError error);

	public int getErrorCount();

	/**
	 * Retains every error reported and logs each as a warning.
	 */
	public static class Default implements ErrorHandler {
		private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

		private final List<SyntaxError> errors = new ArrayList<>();

		@Override
		public void report(SyntaxError error) {
			logger.atWarning().log("%s", error);
			errors.add(error);
		}

		@Override
		public int getErrorCount() {
			return errors.size();
		}

		public List<SyntaxError> getErrors() {
			return Collections.unmodifiableList(errors);
		}
	}

	/**
	 * Counts errors without retaining or logging them.
	 */
	public static class Null implements ErrorHandler {
		private int count;

		@Override
		public void report(SyntaxError error) {
			count++;
		}

		@Override
		public int getErrorCount() {
			return count;
		}
	}
}
