package org.nlp2phenome.om;

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
import static org.junit.jupiter.api.Assertions.assertFalse;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.junit.jupiter.api.Test;

class SemEhrDocumentTest {

	private static ConceptMention mention(String text, int start, int end, String cui, String pref) {
		return new ConceptMention(text, start, end, "cui-" + start, Negation.AFFIRMED, null, null, cui,
				"Disease or Syndrome", pref);
	}

	@Test
	void learnMappings_records_overlapping_concepts_and_every_gold_string() {
		SemEhrDocument doc = new SemEhrDocument(
				List.of(mention("stroke", 14, 20, "C0038454", "Cerebrovascular accident"),
						// strictly inside the gold entity: not recorded
						mention("bleed", 30, 35, "C0019080", "Haemorrhage")),
				List.of(), List.of(), List.of());
		GoldDocument gold = new GoldDocument(100, List.of(
				LabelledEntity.gold("Stroke", 14, 20, "stroke", false, "0"),
				LabelledEntity.gold("brain bleed here", 24, 40, "haemorrhage", false, "1"),
				LabelledEntity.gold("TIA", 60, 63, "stroke", false, "2")), "");

		Map<String, Set<String>> insts = new HashMap<>();
		Map<String, List<String>> missed = new HashMap<>();
		doc.learnMappings(gold, insts, missed);

		assertEquals(Set.of("C0038454\tCerebrovascular accident\tDisease or Syndrome"), insts.get("stroke"));
		assertFalse(insts.containsKey("haemorrhage"));
		assertEquals(List.of("stroke", "tia"), missed.get("stroke"));
		assertEquals(List.of("brain bleed here"), missed.get("haemorrhage"));
	}
}
