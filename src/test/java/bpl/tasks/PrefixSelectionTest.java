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

import static org.junit.Assert.assertEquals;

import java.util.Arrays;
import java.util.Collection;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameters;

/**
 * Checks the prefix chosen for generated labels against sets of labels that
 * already occur in an implementation.
 */
@RunWith(Parameterized.class)
public class PrefixSelectionTest {
	// Label sets paired with the prefix they force.
	@Parameters(name = "{0}")
	public static Collection<Object[]> data() {
		return Arrays.asList(new Object[][] {
			{ "none", new String[0], "anon" },
			{ "unrelated", new String[] { "loop", "exit" }, "anon" },
			{ "digit", new String[] { "anon0" }, "anon1" },
			{ "suffix", new String[] { "anon3_LoopHead" }, "anon0" },
			{ "exact", new String[] { "anon" }, "anon0" },
			{ "chain", new String[] { "anon0", "anon10" }, "anon11" },
			{ "order", new String[] { "anon10", "anon0" }, "anon00" },
		});
	}

	private final String[] labels;
	private final String expected;

	public PrefixSelectionTest(String name, String[] labels, String expected) {
		this.labels = labels;
		this.expected = expected;
	}

	@Test
	public void prefix() {
		NamingContext naming = new NamingContext();
		for (String label : labels) {
			naming.reserve(label);
		}
		assertEquals(expected, naming.getPrefix());
	}
}
