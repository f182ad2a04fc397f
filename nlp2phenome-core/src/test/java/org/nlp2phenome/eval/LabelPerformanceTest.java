package org.nlp2phenome.eval;

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

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

class LabelPerformanceTest {

	@Test
	void metrics_from_counts() {
		LabelPerformance p = new LabelPerformance("stroke");
		p.increaseTruePositive(3);
		p.increaseFalsePositive();
		p.increaseFalseNegative(2);

		assertEquals(0.75, p.getPrecision());
		assertEquals(0.6, p.getRecall());
		assertEquals(2 / (1 / 0.75 + 1 / 0.6), p.getF1(), 1e-12);
		assertEquals(5, p.getInstances());
	}

	@Test
	void nothing_detected_leaves_precision_undefined() {
		LabelPerformance p = new LabelPerformance("atrophy");
		p.increaseFalseNegative();

		assertEquals(LabelPerformance.UNDEFINED, p.getPrecision());
		assertEquals(0.0, p.getRecall());
		assertEquals(LabelPerformance.UNDEFINED, p.getF1());
	}

	@Test
	void zero_precision_makes_f1_undefined() {
		LabelPerformance p = new LabelPerformance("stroke");
		p.increaseFalsePositive();
		p.increaseFalseNegative();

		assertEquals(0.0, p.getPrecision());
		assertEquals(0.0, p.getRecall());
		assertEquals(-1.0, p.getF1());
	}

	@Test
	void empty_label_is_fully_undefined() {
		LabelPerformance p = new LabelPerformance("stroke");

		assertEquals(-1.0, p.getPrecision());
		assertEquals(-1.0, p.getRecall());
		assertEquals(-1.0, p.getF1());
		assertEquals("stroke [tp=0, fn=0, fp=0]", p.toString());
	}
}
