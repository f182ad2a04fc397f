package org.nlp2phenome.model;

/*
 * This file is part of NLP2Phenome.
 *
 * Copyright (C) 2025 GlaxoSmithKline
 *
 * NLP2Phenome is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * NLP2Phenome is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with NLP2Phenome.  If not, see <https://www.gnu.org/licenses/>.
 */

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.nlp2phenome.om.LabelledEntity;

class LabelModelTest {

	@TempDir
	Path tmp;

	private static LabelledEntity ann(String text, boolean negated) {
		return LabelledEntity.gold(text, 0, text.length(), "stroke", negated, "x");
	}

	@Test
	void weighted_score_per_membership() {
		LabelModel lm = new LabelModel("stroke");
		for (int i = 0; i < 3; i++)
			lm.addContextDimension("headache", false, true);
		lm.addContextDimension("infarct", true, false);
		lm.addContextDimension("infarct", true, false);
		lm.addContextDimension("aspirin", true, false);
		lm.addContextDimension("aspirin", false, true);
		lm.addContextDimension("fever");

		lm.setInstanceCounts(10, 5);

		assertEquals(6.0, lm.weightedScore("headache"));
		assertEquals(2.0, lm.weightedScore("infarct"));
		assertEquals(0.0, lm.weightedScore("aspirin"));
		assertEquals(0.0, lm.weightedScore("fever"));
	}

	@Test
	void weighted_score_without_both_counts_divides_by_membership() {
		LabelModel lm = new LabelModel("stroke");
		lm.addContextDimension("headache", false, true);
		lm.addContextDimension("headache");

		lm.setInstanceCounts(4, 0);

		assertEquals(2.0, lm.weightedScore("headache"));
	}

	@Test
	void top_frequency_ties_keep_insertion_order() {
		LabelModel lm = new LabelModel("stroke");
		lm.addContextDimension("a");
		lm.addContextDimension("b");
		lm.addContextDimension("c");
		lm.addContextDimension("c");

		assertEquals(List.of("c", "a"), lm.getTopFrequencyDimensions(2));
		assertEquals(List.of("c", "a", "b"), lm.getTopFrequencyDimensions(10));
	}

	@Test
	void top_weighted_selection_is_refreshed_when_dimensions_change() {
		LabelModel lm = new LabelModel("stroke");
		lm.addContextDimension("infarct", true, false);
		lm.addContextDimension("headache", false, true);
		lm.setInstanceCounts(1, 1);

		assertEquals(List.of("infarct"), lm.getTopWeightedDimensions(1));

		lm.addContextDimension("headache", false, true);

		assertEquals(List.of("headache"), lm.getTopWeightedDimensions(1));
	}

	@Test
	void context_dimensions_are_lower_cased_and_counted() {
		LabelModel lm = new LabelModel("stroke");
		lm.addContextDimension("Headache");
		lm.addContextDimension("headache");

		assertEquals(List.of("headache"), lm.getContextDimensions());
		assertEquals(2, lm.getFrequency("headache"));
		assertEquals(0, lm.getFrequency("fever"));
	}

	@Test
	void encode_with_label_index_and_empty_frequency_slots() {
		LabelModel lm = new LabelModel("stroke", 2);
		lm.addLabelDimensionByAnnotation(ann("stroke", false));
		lm.addLabelDimensionByAnnotation(ann("Stroke", true));
		lm.addContextDimension("headache", true, false);
		lm.addContextDimension("fever", true, false);

		int[] x = lm.encode(ann("stroke", true), List.of(ann("fever", false)));

		assertEquals(List.of("stroke", "neg_stroke"), lm.getLabelDimensions());
		assertArrayEquals(new int[] { 1, 0, 0, 1, 0 }, x);
		assertEquals(-1, lm.encode(ann("cva", false), List.of())[0]);
	}

	@Test
	void encode_one_hot_label() {
		LabelModel lm = new LabelModel("stroke", 1);
		lm.setUseOneDimensionForLabel(false);
		lm.addLabelDimension("stroke");
		lm.addLabelDimension("neg_stroke");
		lm.addContextDimension("headache", true, false);

		int[] x = lm.encode(ann("stroke", true), List.of(ann("headache", false)));

		assertArrayEquals(new int[] { 0, 1, 1, 0 }, x);
	}

	@Test
	void serialise_round_trip() throws Exception {
		LabelModel lm = new LabelModel("neg_stroke", 20);
		lm.addLabelDimension("neg_stroke");
		lm.addContextDimension("headache", false, true);
		lm.setInstanceCounts(3, 7);
		lm.getTopWeightedDimensions(20);
		Path file = tmp.resolve("models/neg_stroke.lm");

		lm.serialise(file);
		LabelModel back = LabelModel.deserialise(file);

		assertEquals("neg_stroke", back.getLabel());
		assertEquals(20, back.getMaxDimensions());
		assertEquals(List.of("neg_stroke"), back.getLabelDimensions());
		assertEquals(List.of("headache"), back.getTopWeightedDimensions(20));
		assertEquals(7, back.getFalsePositiveCount());
	}

	@Test
	void deserialise_rejects_other_files() throws Exception {
		Path file = Files.writeString(tmp.resolve("junk.lm"), "not a model");

		assertThrows(IOException.class, () -> LabelModel.deserialise(file));
	}
}
