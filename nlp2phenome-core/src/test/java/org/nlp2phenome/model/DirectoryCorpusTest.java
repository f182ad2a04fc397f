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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.nlp2phenome.Fixtures;
import org.nlp2phenome.processing.load.LoadResult;
import org.nlp2phenome.umls.ConceptMapping;

class DirectoryCorpusTest {

	@TempDir
	Path tmp;

	@Test
	void keys_are_annotation_file_stems_sorted() throws Exception {
		Fixtures.copyCorpus(tmp);
		Files.writeString(tmp.resolve("ann/doc2.json"), "{}");
		Files.writeString(tmp.resolve("ann/notes.txt"), "ignored");

		DirectoryCorpus corpus = DirectoryCorpus.open(tmp.resolve("ann"), tmp.resolve("gold"),
				ConceptMapping.fromTable(Map.of()));

		assertEquals(List.of("doc1", "doc2"), corpus.keys());
		assertTrue(corpus.recogniser("doc1").isFound());
		assertTrue(corpus.gold("doc1").isFound());
		assertEquals(LoadResult.Status.NOT_FOUND, corpus.gold("doc2").getStatus());
	}

	@Test
	void broken_record_is_unreadable() throws Exception {
		Files.createDirectories(tmp.resolve("ann"));
		Files.writeString(tmp.resolve("ann/doc9.json"), "{ not json");

		DirectoryCorpus corpus = DirectoryCorpus.open(tmp.resolve("ann"), null, ConceptMapping.fromTable(Map.of()));
		LoadResult<?> cr = corpus.recogniser("doc9");

		assertEquals(LoadResult.Status.UNREADABLE, cr.getStatus());
		assertFalse(corpus.gold("doc9").isFound());
	}
}
