package works.reshape.engine;

import java.util.List;
import works.reshape.template.Member;
import works.reshape.value.SequenceValue;
import works.reshape.value.Value;

/**
 * Supplies the values of {@link Member#isBound() bound} members while one copy
 * of a conversion body is evaluated: slot {@code s} gets element {@link #index}
 * of the sequence produced by spread source {@code s}.
 */
final class Bindings {
	static final Bindings NONE = new Bindings(List.of(), -1);

	private final List<SequenceValue> sequences;
	private final int index;

	Bindings(List<SequenceValue> sequences, int index) {
		this.sequences = List.copyOf(sequences);
		this.index = index;
	}

	boolean binds(Member member) {
		return member.isBound() && member.spreadSlot() < sequences.size();
	}

	Value valueOf(Member member) {
		return sequences.get(member.spreadSlot()).get(index);
	}

	@Override
	public String toString() {
		return "Bindings(index=" + index + ", slots=" + sequences.size() + ")";
	}
}
