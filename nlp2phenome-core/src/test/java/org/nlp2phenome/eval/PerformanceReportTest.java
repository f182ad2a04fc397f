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

import java.util.LinkedHashMap;
import java.util.Map;

import org.junit.jupiter.api.Test;

class PerformanceReportTest {

	@Test
	void table_has_banner_header_and_one_row_per_label() {
		LabelPerformance stroke = new LabelPerformance("stroke");
		stroke.increaseTruePositive();
		stroke.increaseFalsePositive();
		LabelPerformance atrophy = new LabelPerformance("atrophy");
		atrophy.increaseFalseNegative();
		Map<String, LabelPerformance> l2p = new LinkedHashMap<>();
		l2p.put("stroke", stroke);
		l2p.put("atrophy", atrophy);

		String table = PerformanceReport.format(l2p);

		assertEquals("**********performance**********\n"
				+ "label\tprecision\trecall\tf1\t#insts\tfalse positive\n"
				+ "stroke\t0.5\t1.0\t0.6666666666666666\t1\t1\n"
				+ "atrophy\t-1.0\t0.0\t-1.0\t1\t0\n", table);
	}

	@Test
	void empty_map_prints_header_only() {
		assertEquals(PerformanceReport.BANNER + "\nlabel\tprecision\trecall\tf1\t#insts\tfalse positive\n",
				PerformanceReport.format(new LinkedHashMap<>()));
	}
}
