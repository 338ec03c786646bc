package works.reshape.engine;

import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.reshape.exceptions.SpreadLengthMismatchException;
import works.reshape.exceptions.SpreadTypeMismatchException;
import works.reshape.template.ConversionNode;
import works.reshape.template.SpreadSource;
import works.reshape.value.SequenceValue;
import works.reshape.value.Value;

/**
 * Turns a {@link ConversionNode} into an array ("zipping" its spread sources).
 * <p>
 * Copy {@code i} of the body gets element {@code i} of every spread source;
 * all other members are evaluated normally, so they are identical in every copy.
 */
final class ArrayConverter {
	private final TemplateWalker walker;

	ArrayConverter(TemplateWalker walker) {
		this.walker = walker;
	}

	SequenceValue convert(Value source, ConversionNode conversion, int depth) {
		List<SequenceValue> sequences = new ArrayList<>(conversion.spreadSources().size());
		SpreadSource first = null;
		for (SpreadSource spread: conversion.spreadSources()) {
			Value value = walker.render(source, spread.node(), Bindings.NONE, depth + 1);
			if (!(value instanceof SequenceValue sequence)) {
				throw new SpreadTypeMismatchException(spread.location(), value.typeName());
			}
			if (first == null) {
				first = spread;
			} else if (sequence.size() != sequences.get(0).size()) {
				throw new SpreadLengthMismatchException(
					conversion.location(),
					first.location(), sequences.get(0).size(),
					spread.location(), sequence.size());
			}
			sequences.add(sequence);
		}

		int length = sequences.get(0).size();
		LOGGER.debug("Converting {} into {} element(s) using {} spread source(s)", conversion.location(), length, sequences.size());
		List<Value> copies = new ArrayList<>(length);
		for (int i = 0; i < length; i++) {
			copies.add(walker.render(source, conversion.body(), new Bindings(sequences, i), depth + 1));
		}
		return SequenceValue.of(copies);
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(ArrayConverter.class);
}
