package org.nlp2phenome.processing.load;

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

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class AnnotationDumpSplitterTest {

	@TempDir
	Path tmp;

	@Test
	void one_record_per_doc_named_after_doc_id_without_extension() throws Exception {
		Path dumps = Files.createDirectories(tmp.resolve("dumps"));
		Files.writeString(dumps.resolve("part-0"), String.join("\n",
				"{\"docId\": \"doc1.txt\", \"annotations\": []}",
				"",
				"{\"annotations\": []}",
				"{\"docId\": \"doc2.txt\", \"annotations\": [[]]}"));
		Path out = tmp.resolve("out");

		int written = new AnnotationDumpSplitter().splitAll(dumps, out);

		assertEquals(2, written);
		assertEquals("{\"docId\": \"doc1.txt\", \"annotations\": []}", Files.readString(out.resolve("doc1.json")));
		assertTrue(Files.exists(out.resolve("doc2.json")));
	}

	@Test
	void full_text_exporter_writes_txt_per_gold_document() throws Exception {
		Path gold = Files.createDirectories(tmp.resolve("gold"));
		Files.copy(Path.of(getClass().getResource("/fixtures/gold/doc1-ann.xml").toURI()),
				gold.resolve("doc1-ann.xml"));
		Files.writeString(gold.resolve("notes.txt"), "not xml");
		Files.copy(gold.resolve("doc1-ann.xml"), gold.resolve("copy.xml"));
		Path out = tmp.resolve("text");

		int n = new FullTextExporter(new EdirGoldReader()).exportAll(gold, out);

		assertEquals(1, n);
		assertEquals("Patient had a stroke. No hypertension or atrophy.", Files.readString(out.resolve("doc1.txt")));
		assertFalse(Files.exists(out.resolve("copy.xml")));
		assertFalse(new FullTextExporter(new EdirGoldReader()).export(gold.resolve("missing-ann.xml"), out));
	}

	@Test
	void malformed_line_is_skipped() throws Exception {
		Path dump = Files.writeString(tmp.resolve("part-1"), String.join("\n",
				"{\"docId\": \"doc1.txt\", \"annotations\": []}",
				"{\"docId\": \"doc2.txt\", \"annotations\": [",
				"{\"docId\": \"doc3.txt\", \"annotations\": []}"));
		Path out = Files.createDirectories(tmp.resolve("out"));

		int written = new AnnotationDumpSplitter().split(dump, out);

		assertEquals(2, written);
		assertTrue(Files.exists(out.resolve("doc3.json")));
		assertFalse(Files.exists(out.resolve("doc2.json")));
	}
}
