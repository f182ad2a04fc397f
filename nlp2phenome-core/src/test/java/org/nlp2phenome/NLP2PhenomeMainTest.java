package org.nlp2phenome;

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

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;
import java.util.stream.Stream;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.nlp2phenome.conf.ConfigLoader;

class NLP2PhenomeMainTest {

	@TempDir
	Path tmp;

	private ConfigLoader config(Properties p) throws IOException {
		Path f = tmp.resolve("nlp2phenome.properties");
		try (var out = Files.newOutputStream(f)) {
			p.store(out, "test");
		}
		return new ConfigLoader(f);
	}

	private Properties corpusProps() throws IOException {
		Fixtures.copyCorpus(tmp);
		Properties p = new Properties();
		p.setProperty("ANN_DIR", tmp.resolve("ann").toString());
		p.setProperty("GOLD_DIR", tmp.resolve("gold").toString());
		p.setProperty("TEST_ANN_DIR", tmp.resolve("test_ann").toString());
		p.setProperty("TEST_GOLD_DIR", tmp.resolve("gold").toString());
		p.setProperty("CONCEPT_MAPPING_FILE", Fixtures.resource("concept_mapping.json").toString());
		p.setProperty("LEARNING_MODEL_DIR", tmp.resolve("models").toString());
		p.setProperty("ENTITY_TYPES_FILE", Fixtures.resource("entity_types.txt").toString());
		return p;
	}

	@Test
	void missing_or_unknown_command_prints_usage() throws Exception {
		NLP2PhenomeMain main = new NLP2PhenomeMain(config(new Properties()));

		assertEquals(NLP2PhenomeMain.EXIT_USAGE, main.run(new String[0]));
		assertEquals(NLP2PhenomeMain.EXIT_USAGE, main.run(new String[] { "train" }));
	}

	@Test
	void missing_configuration_fails_the_command() throws Exception {
		NLP2PhenomeMain main = new NLP2PhenomeMain(config(new Properties()));

		assertEquals(NLP2PhenomeMain.EXIT_FAILED, main.run(new String[] { "learn" }));
		assertEquals(NLP2PhenomeMain.EXIT_FAILED, main.run(new String[] { "export-text" }));
	}

	@Test
	void validate_runs_on_configured_corpus() throws Exception {
		NLP2PhenomeMain main = new NLP2PhenomeMain(config(corpusProps()));

		assertEquals(NLP2PhenomeMain.EXIT_OK, main.run(new String[] { "validate", "combined" }));
	}

	@Test
	void learn_mappings_writes_gazetteers() throws Exception {
		Properties p = corpusProps();
		p.setProperty("GAZETTEER_DIR", tmp.resolve("gazetteer").toString());

		assertEquals(NLP2PhenomeMain.EXIT_OK, new NLP2PhenomeMain(config(p)).run(new String[] { "learn-mappings" }));
		assertEquals("stroke\n", Files.readString(tmp.resolve("gazetteer/stroke.lst"), StandardCharsets.UTF_8));
	}

	@Test
	void export_text_writes_one_file_per_gold_document() throws Exception {
		Properties p = corpusProps();
		p.setProperty("FULLTEXT_DIR", tmp.resolve("text").toString());

		assertEquals(NLP2PhenomeMain.EXIT_OK, new NLP2PhenomeMain(config(p)).run(new String[] { "export-text" }));
		try (Stream<Path> files = Files.list(tmp.resolve("text"))) {
			assertEquals(1, files.count());
		}
	}

	@Test
	void command_names() {
		assertTrue(NLP2PhenomeMain.isCommand("validate"));
		assertFalse(NLP2PhenomeMain.isCommand("VALIDATE"));
	}
}
