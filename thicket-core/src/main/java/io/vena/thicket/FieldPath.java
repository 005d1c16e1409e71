package io.vena.thicket;

import java.util.Iterator;
import java.util.List;
import lombok.EqualsAndHashCode;

import static java.util.Arrays.asList;
import static java.util.Collections.unmodifiableList;

/**
 * A dotted path into entity data, like <code>profile.address.city</code>.
 *
 * <p>
 * The first segment may name a declared field; the remaining segments
 * navigate inside that field's map value.
 * Empty segments are rejected with {@link IllegalArgumentException}.
 */
@EqualsAndHashCode
public final class FieldPath implements Iterable<String> {
	private final List<String> segments;

	private FieldPath(List<String> segments) {
		this.segments = unmodifiableList(segments);
	}

	public static FieldPath parse(String dotted) {
		if (dotted == null || dotted.isEmpty()) {
			throw new IllegalArgumentException("Path must not be empty");
		}
		String[] parts = dotted.split("\\.", -1);
		for (String part: parts) {
			if (part.isEmpty()) {
				throw new IllegalArgumentException("Path has an empty segment: \"" + dotted + "\"");
			}
		}
		return new FieldPath(asList(parts));
	}

	public int length() {
		return segments.size();
	}

	public String segment(int index) {
		return segments.get(index);
	}

	public String head() {
		return segments.get(0);
	}

	public boolean isSingleSegment() {
		return segments.size() == 1;
	}

	/**
	 * @return the path after the first segment
	 * @throws IllegalStateException if this path has only one segment
	 */
	public FieldPath tail() {
		if (isSingleSegment()) {
			throw new IllegalStateException("Path has no tail: " + this);
		}
		return new FieldPath(segments.subList(1, segments.size()));
	}

	public List<String> segments() {
		return segments;
	}

	@Override
	public Iterator<String> iterator() {
		return segments.iterator();
	}

	@Override
	public String toString() {
		return String.join(".", segments);
	}
}
