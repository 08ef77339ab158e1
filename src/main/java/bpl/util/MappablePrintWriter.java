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

import java.io.OutputStream;
import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.List;

/**
 * A print writer which remembers which item each piece of printed text came
 * from. This allows a position in the output (e.g. as reported by a tool
 * consuming it) to be mapped back to the item responsible.
 *
 * @param <T>
 */
public class MappablePrintWriter<T> {
	private final PrintWriter out;
	private final Mapping<T> mapping;
	private int column;

	public MappablePrintWriter(OutputStream os) {
		this(new PrintWriter(os));
	}

	public MappablePrintWriter(PrintWriter writer) {
		this.out = writer;
		this.mapping = new Mapping<>();
	}

	public Mapping<T> getMapping() {
		return mapping;
	}

	/**
	 * Print a string which is not associated with any tag.
	 *
	 * @param text
	 */
	public void print(String text) {
		out.print(text);
		column += text.length();
	}

	/**
	 * Print a string associated with a given tag.
	 *
	 * @param text
	 * @param tag
	 */
	public void print(String text, T tag) {
		out.print(text);
		mapping.put(tag, column, text.length());
		column += text.length();
	}

	public void println() {
		out.println();
		mapping.newLine();
		column = 0;
	}

	public void println(String text) {
		print(text);
		println();
	}

	public void println(String text, T tag) {
		print(text, tag);
		println();
	}

	/**
	 * Print a given level of indentation.
	 *
	 * @param n
	 */
	public void tab(int n) {
		for(int i=0;i!=n;++i) {
			print("   ");
		}
	}

	public void flush() {
		out.flush();
	}

	public static class Mapping<T> {
		private final List<List<Span<T>>> lines = new ArrayList<>();

		public Mapping() {
			newLine();
		}

		public void put(T tag, int start, int length) {
			if (length > 0) {
				lines.get(lines.size() - 1).add(new Span<>(tag, start, start + length - 1));
			}
		}

		public void newLine() {
			lines.add(new ArrayList<>());
		}

		/**
		 * Get the tag responsible for a given position, or <code>null</code> if
		 * there is none. Lines are numbered from one and columns from zero.
		 *
		 * @param line
		 * @param col
		 * @return
		 */
		public T get(int line, int col) {
			if (line < 1 || line > lines.size()) {
				return null;
			}
			for (Span<T> s : lines.get(line - 1)) {
				if (s.contains(col)) {
					return s.tag;
				}
			}
			return null;
		}
	}

	private static class Span<T> {
		private final T tag;
		private final int start;
		private final int end;

		public Span(T tag, int start, int end) {
			this.tag = tag;
			this.start = start;
			this.end = end;
		}

		public boolean contains(int col) {
			return start <= col && col <= end;
		}
	}
}
