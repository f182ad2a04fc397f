package org.nlp2phenome.umls;

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
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ConceptMappingTest {

	@TempDir
	Path tmp;

	private static Path fixture(String name) throws Exception {
		return Path.of(ConceptMappingTest.class.getResource("/fixtures/" + name).toURI());
	}

	@Test
	void load_builds_concept_to_labels_and_preferred_terms() throws Exception {
		ConceptMapping cm = ConceptMapping.load(fixture("concept_mapping.json"));

		assertEquals(List.of("stroke"), cm.labelsOf("C0038454"));
		assertEquals(List.of("hypertension"), cm.labelsOf("C0020538"));
		assertEquals("Cerebrovascular accident", cm.preferredTerm("C0038454"));
		// last entry read wins
		assertEquals("High blood pressure", cm.preferredTerm("C0020538"));
		assertTrue(cm.labelsOf("C9999999").isEmpty());
	}

	@Test
	void concept_listed_under_several_labels_keeps_label_order_without_duplicates() {
		Map<String, List<String>> table = new LinkedHashMap<>();
		table.put("stroke", List.of("C0038454\tStroke", "C0038454\tStroke"));
		table.put("cerebrovascular", List.of("C0038454\tCVA"));

		ConceptMapping cm = ConceptMapping.fromTable(table);

		assertEquals(List.of("stroke", "cerebrovascular"), cm.labelsOf("C0038454"));
		assertEquals("CVA", cm.preferredTerm("C0038454"));
	}

	@Test
	void concept_id_is_the_first_eight_characters() {
		ConceptMapping cm = ConceptMapping.fromTable(Map.of("stroke", List.of("C0038454extra\tStroke")));
		assertTrue(cm.isMapped("C0038454"));
	}

	@Test
	void missing_file_fails_fast() {
		assertThrows(IllegalArgumentException.class, () -> ConceptMapping.load(tmp.resolve("absent.json")));
	}

	@Test
	void ignore_mappings_load_and_strip_negation() throws Exception {
		IgnoreMappings im = IgnoreMappings.load(fixture("ignore_mappings.json"));

		assertEquals(List.of("C0751956", "mini stroke"), im.forLabel("stroke"));
		assertEquals(List.of("C0751956", "mini stroke"), im.forLabel("neg_stroke"));
		assertTrue(im.forLabel("atrophy").isEmpty());
	}

	@Test
	void absent_ignore_file_means_nothing_is_ignored() throws Exception {
		assertTrue(IgnoreMappings.load(tmp.resolve("none.json")).forLabel("stroke").isEmpty());
		assertTrue(IgnoreMappings.load(null).forLabel("stroke").isEmpty());
		Files.writeString(tmp.resolve("empty.json"), "{}");
		assertTrue(IgnoreMappings.load(tmp.resolve("empty.json")).forLabel("stroke").isEmpty());
	}
}
