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

import java.util.HashMap;
import java.util.Map;


/**
 * Error codes and the message associated with each. Messages are format
 * strings whose arguments are supplied when the error is raised.
 *
 */
public class ErrorMessages {
	// Labels and breaks
	public static final int UNDEFINED_OR_OUT_OF_REACH_LABEL = 100;
	public static final int BREAK_OUTSIDE_LOOP = 101;
	public static final int BREAK_LABEL_UNDEFINED = 102;
	public static final int BREAK_TARGET_INVALID = 103;
	public static final int DUPLICATE_LABEL = 104;
	// Calls
	public static final int UNDECLARED_PROCEDURE = 200;
	public static final int ARITY_MISMATCH = 201;
	public static final int ASYNC_ARITY_OR_TYPE_ERROR = 202;
	public static final int MODIFIES_CLAUSE_VIOLATION = 203;
	public static final int INCOMPATIBLE_ARGUMENT_TYPE = 204;
	// Commands
	public static final int DUPLICATE_PARALLEL_ASSIGNMENT_TARGET = 300;
	public static final int ASSIGNMENT_COUNT_MISMATCH = 301;
	public static final int UNDECLARED_VARIABLE = 302;
	public static final int NON_BOOLEAN_PREDICATE = 303;

	private static final Map<Integer, String> MESSAGES = new HashMap<>();

	static {
		MESSAGES.put(UNDEFINED_OR_OUT_OF_REACH_LABEL, "goto label '%s' is undefined or out of reach");
		MESSAGES.put(BREAK_OUTSIDE_LOOP, "break statement is not inside a loop");
		MESSAGES.put(BREAK_LABEL_UNDEFINED, "break label '%s' must designate an enclosing statement");
		MESSAGES.put(BREAK_TARGET_INVALID, "break label '%s' must designate an enclosing statement");
		MESSAGES.put(DUPLICATE_LABEL, "label '%s' is declared more than once");
		MESSAGES.put(UNDECLARED_PROCEDURE, "call to undeclared procedure: %s");
		MESSAGES.put(ARITY_MISMATCH, "wrong number of %s in call to %s: %d");
		MESSAGES.put(ASYNC_ARITY_OR_TYPE_ERROR, "asynchronous call to %s %s");
		MESSAGES.put(MODIFIES_CLAUSE_VIOLATION, "call forall is allowed only on procedures with no modifies clause");
		MESSAGES.put(INCOMPATIBLE_ARGUMENT_TYPE, "incompatible type for %s in call to %s");
		MESSAGES.put(DUPLICATE_PARALLEL_ASSIGNMENT_TARGET, "variable '%s' is assigned more than once");
		MESSAGES.put(ASSIGNMENT_COUNT_MISMATCH, "number of left-hand sides (%d) does not match number of right-hand sides (%d)");
		MESSAGES.put(UNDECLARED_VARIABLE, "undeclared variable: %s");
		MESSAGES.put(NON_BOOLEAN_PREDICATE, "%s expression must be of type bool");
	}

	public static String getErrorMessage(int code, Object... context) {
		String template = MESSAGES.get(code);
		if (template == null) {
			throw new IllegalArgumentException("unknown error code " + code);
		}
		return String.format(template, context);
	}

	/**
	 * Construct a syntax error for a given element.
	 *
	 * @param item
	 *            The offending item
	 * @param code
	 *            The error code (see above)
	 * @param context
	 *            Arguments for the error message
	 * @return
	 */
	public static SyntaxError syntaxError(Object item, int code, Object... context) {
		return new SyntaxError(code, item, getErrorMessage(code, context));
	}
}
