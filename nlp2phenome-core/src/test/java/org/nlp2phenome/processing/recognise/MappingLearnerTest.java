package org.nlp2phenome.processing.recognise;

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

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.nlp2phenome.Fixtures;
import org.nlp2phenome.model.DirectoryCorpus;
import org.nlp2phenome.umls.ConceptMapping;

class MappingLearnerTest {

	@TempDir
	Path tmp;

	private MappingLearner learner;

	@BeforeEach
	void setUp() throws Exception {
		Fixtures.copyCorpus(tmp);
		// annotations without a gold standard are ignored
		Files.copy(tmp.resolve("ann/doc1.json"), tmp.resolve("ann/doc2.json"));
		DirectoryCorpus corpus = DirectoryCorpus.open(tmp.resolve("ann"), tmp.resolve("gold"),
				ConceptMapping.fromTable(Map.of()));
		learner = new MappingLearner(corpus);
	}

	@Test
	void learns_concepts_overlapping_gold_entities() throws Exception {
		assertEquals(1, learner.learn());

		assertEquals(Set.of("C0038454\tCerebrovascular accident\tDisease or Syndrome"),
				learner.getConceptInstances().get("stroke"));
		assertEquals(Set.of("C0020538\tHypertensive disease\tDisease or Syndrome"),
				learner.getConceptInstances().get("hypertension"));
		assertFalse(learner.getConceptInstances().containsKey("atrophy"));
	}

	@Test
	void every_gold_string_is_recorded_lower_cased() throws Exception {
		learner.learn();

		assertEquals(List.of("stroke"), learner.getMissed().get("stroke"));
		assertEquals(List.of("no atrophy"), learner.getMissed().get("atrophy"));
	}

	@Test
	void writes_one_gazetteer_list_per_label() throws Exception {
		learner.learn();
		Path out = tmp.resolve("gazetteer");

		List<String> defs = learner.writeGazetteers(out, "Phenotype");

		assertEquals(List.of("stroke.lst:Phenotype:stroke", "hypertension.lst:Phenotype:hypertension",
				"atrophy.lst:Phenotype:atrophy"), defs);
		assertEquals("no atrophy\n", Files.readString(out.resolve("atrophy.lst"), StandardCharsets.UTF_8));
	}
}
