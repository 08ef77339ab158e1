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
package bpl.tasks;

/**
 * The state shared by every part of lowering a single body: the prefix used
 * for synthesised labels and a counter which makes each such label unique.
 * The prefix is chosen so that no synthesised label can clash with a label
 * declared in the body. A fresh context should be used for each body.
 *
 * @author David J. Pearce
 *
 */
public class NamingContext {
	public static final String DEFAULT_PREFIX = "anon";

	private String prefix;
	private int counter;

	public NamingContext() {
		this(DEFAULT_PREFIX);
	}

	public NamingContext(String prefix) {
		if (prefix == null || prefix.isEmpty()) {
			throw new IllegalArgumentException("label prefix cannot be empty");
		}
		this.prefix = prefix;
	}

	public String getPrefix() {
		return prefix;
	}

	public int getCounter() {
		return counter;
	}

	/**
	 * Account for a label declared in the body being lowered. If the label starts
	 * with the current prefix, then the prefix is extended so that it no longer
	 * does. Specifically, the next character of the label is avoided.
	 *
	 * @param label
	 */
	public void reserve(String label) {
		if (label.startsWith(prefix)) {
			if (prefix.length() < label.length() && label.charAt(prefix.length()) == '0') {
				prefix = prefix + "1";
			} else {
				prefix = prefix + "0";
			}
		}
	}

	/**
	 * Generate a fresh name consisting of the prefix and the next counter value.
	 *
	 * @return
	 */
	public String fresh() {
		return prefix + (counter++);
	}
}
