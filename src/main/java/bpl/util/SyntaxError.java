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

import bpl.core.BoogieFile;

/**
 * A diagnostic reported against some item of a Boogie program. The item may be
 * <code>null</code> for structural errors (e.g. a misplaced
 * <code>break</code>) which have no corresponding item.
 *
 */
public class SyntaxError {
	private final int code;
	private final Object item;
	private final String message;

	public SyntaxError(int code, Object item, String message) {
		this.code = code;
		this.item = item;
		this.message = message;
	}

	public int getErrorCode() {
		return code;
	}

	/**
	 * Get the element this error was reported against. This is either an item
	 * of the program model or part of a structured body.
	 *
	 * @return
	 */
	public Object getElement() {
		return item;
	}

	public <T> T getAttribute(Class<T> kind) {
		if (item instanceof BoogieFile.Item) {
			return ((BoogieFile.Item) item).getAttribute(kind);
		}
		return null;
	}

	public String getMessage() {
		return message;
	}

	@Override
	public String toString() {
		return "Error " + code + ": " + message;
	}
}
