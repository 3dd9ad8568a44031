package elmfmt.doc;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;

/**
 * 
 * Lays a {@link Doc} out for a page width. Work is driven by an explicit stack of
 * (indent, mode, document) frames so that deeply nested documents cannot exhaust
 * the call stack.
 * 
 * A group is flattened when everything from the current column up to the next
 * line break of the remaining input fits in the page width (the boundary is
 * inclusive) and the group holds no hard line. Otherwise it is broken.
 * 
 * Rendering is a pure function of the document and the width.
 *
 */
public class DocRenderer {

	enum Mode {
		FLAT,
		BREAK,
	}

	static final class Frame {
		final int indent;
		final Mode mode;
		final Doc doc;

		Frame(int indent, Mode mode, Doc doc) {
			this.indent = indent;
			this.mode = mode;
			this.doc = doc;
		}
	}

	private final int width;

	public DocRenderer(int width) {
		if (width <= 0) {
			throw new IllegalArgumentException("page width must be positive, got " + width);
		}
		this.width = width;
	}

	public int getWidth() {
		return width;
	}

	public String render(Doc doc) {
		Layout layout = new Layout();
		layout.stack.push(new Frame(0, Mode.BREAK, doc));
		while (!layout.stack.isEmpty()) {
			layout.current = layout.stack.pop();
			layout.current.doc.accept(layout);
		}
		return layout.out.toString();
	}

	private final class Layout extends DocVisitor<Void, RuntimeException> {
		final StringBuilder out = new StringBuilder();
		final Deque<Frame> stack = new ArrayDeque<>();
		Frame current;
		int column = 0;
		// indentation owed to the current line, written only once text arrives
		int pendingIndent = 0;

		private void emit(String text) {
			if (text.isEmpty()) {
				return;
			}
			for (int i = 0; i < pendingIndent; i++) {
				out.append(' ');
			}
			pendingIndent = 0;
			out.append(text);
			column += text.length();
		}

		private void newline(int indent) {
			out.append('\n');
			column = indent;
			pendingIndent = indent;
		}

		private void push(int indent, Mode mode, Doc doc) {
			stack.push(new Frame(indent, mode, doc));
		}

		@Override
		public Void visit(DocEmpty docEmpty) {
			return null;
		}

		@Override
		public Void visit(DocText docText) {
			emit(docText.getText());
			return null;
		}

		@Override
		public Void visit(DocConcat docConcat) {
			push(current.indent, current.mode, docConcat.getRight());
			push(current.indent, current.mode, docConcat.getLeft());
			return null;
		}

		@Override
		public Void visit(DocLine docLine) {
			switch (docLine.getKind()) {
				case SOFT:
					if (current.mode == Mode.FLAT) {
						emit(" ");
					} else {
						newline(current.indent);
					}
					break;
				case HARD:
					newline(current.indent);
					break;
				case LITERAL:
					newline(0);
					break;
			}
			return null;
		}

		@Override
		public Void visit(DocNest docNest) {
			push(current.indent + docNest.getIndent(), current.mode, docNest.getBody());
			return null;
		}

		@Override
		public Void visit(DocGroup docGroup) {
			if (current.mode == Mode.FLAT) {
				push(current.indent, Mode.FLAT, docGroup.getBody());
			} else {
				Frame flat = new Frame(current.indent, Mode.FLAT, docGroup.getBody());
				if (fits(width - column, flat, stack)) {
					stack.push(flat);
				} else {
					push(current.indent, Mode.BREAK, docGroup.getBody());
				}
			}
			return null;
		}

		@Override
		public Void visit(DocFlatAlt docFlatAlt) {
			if (current.mode == Mode.FLAT) {
				push(current.indent, current.mode, docFlatAlt.getFlat());
			} else {
				push(current.indent, current.mode, docFlatAlt.getBroken());
			}
			return null;
		}
	}

	/**
	 * Measures {@code candidate} in its mode followed by the pending frames in theirs,
	 * stopping at the first line break of a broken frame.
	 */
	static boolean fits(int remaining, Frame candidate, Deque<Frame> rest) {
		Measure measure = new Measure(remaining);
		Iterator<Frame> restFrames = rest.iterator();
		measure.work.push(candidate);
		while (measure.remaining >= 0) {
			if (measure.work.isEmpty()) {
				if (!restFrames.hasNext()) {
					return true;
				}
				measure.work.push(restFrames.next());
			}
			measure.current = measure.work.pop();
			Boolean decided = measure.current.doc.accept(measure);
			if (decided != null) {
				return decided;
			}
		}
		return false;
	}

	private static final class Measure extends DocVisitor<Boolean, RuntimeException> {
		final Deque<Frame> work = new ArrayDeque<>();
		int remaining;
		Frame current;

		Measure(int remaining) {
			this.remaining = remaining;
		}

		private void push(Mode mode, Doc doc) {
			work.push(new Frame(current.indent, mode, doc));
		}

		@Override
		public Boolean visit(DocEmpty docEmpty) {
			return null;
		}

		@Override
		public Boolean visit(DocText docText) {
			remaining -= docText.getWidth();
			return null;
		}

		@Override
		public Boolean visit(DocConcat docConcat) {
			push(current.mode, docConcat.getRight());
			push(current.mode, docConcat.getLeft());
			return null;
		}

		@Override
		public Boolean visit(DocLine docLine) {
			if (current.mode == Mode.BREAK) {
				// the rest of the line ends here
				return true;
			}
			if (docLine.getKind() == DocLine.Kind.SOFT) {
				remaining -= 1;
				return null;
			}
			return false;
		}

		@Override
		public Boolean visit(DocNest docNest) {
			push(current.mode, docNest.getBody());
			return null;
		}

		@Override
		public Boolean visit(DocGroup docGroup) {
			push(current.mode, docGroup.getBody());
			return null;
		}

		@Override
		public Boolean visit(DocFlatAlt docFlatAlt) {
			push(current.mode, current.mode == Mode.FLAT ? docFlatAlt.getFlat() : docFlatAlt.getBroken());
			return null;
		}
	}
}
