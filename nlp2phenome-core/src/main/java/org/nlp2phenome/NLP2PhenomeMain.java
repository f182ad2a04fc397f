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

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

import org.nlp2phenome.conf.ConfigLoader;
import org.nlp2phenome.conf.LearningSettings;
import org.nlp2phenome.model.DirectoryCorpus;
import org.nlp2phenome.processing.PhenotypeLearningPipeline;
import org.nlp2phenome.processing.load.AnnotationDumpSplitter;
import org.nlp2phenome.processing.load.EdirGoldReader;
import org.nlp2phenome.processing.load.FullTextExporter;
import org.nlp2phenome.processing.recognise.MappingLearner;
import org.nlp2phenome.umls.ConceptMapping;
import org.nlp2phenome.umls.IgnoreMappings;
import org.nlp2phenome.util.Logger;

/**
 * Main entry point for NLP2Phenome.
 *
 * <pre>
 *   export-text        recover plain text from the test gold documents
 *   split-dump         split SemEHR dumps into per-document records
 *   learn-mappings     learn concept mappings and gazetteer lists
 *   validate [combined] evaluate rule-based label recognition
 *   learn              run the learning experiment for every label
 * </pre>
 *
 * Configuration comes from {@link ConfigLoader}.
 */
public class NLP2PhenomeMain {

	static final int EXIT_OK = 0;
	static final int EXIT_FAILED = 1;
	static final int EXIT_USAGE = 2;

	static final String GAZETTEER_MAJOR_TYPE = "Phenotype";

	static final String USAGE = String.join("\n",
			"usage: nlp2phenome <command>",
			"  export-text          recover plain text from the test gold documents",
			"  split-dump           split SemEHR dumps into per-document records",
			"  learn-mappings       learn concept mappings and gazetteer lists",
			"  validate [combined]  evaluate rule-based label recognition",
			"  learn                run the learning experiment for every label");

	private final ConfigLoader cfg;

	public NLP2PhenomeMain() {
		this(new ConfigLoader());
	}

	NLP2PhenomeMain(ConfigLoader cfg) {
		this.cfg = cfg;
	}

	/**
	 * Application entry point.
	 */
	public static void main(String[] args) {
		int code = new NLP2PhenomeMain().run(args);
		if (code != EXIT_OK)
			System.exit(code);
	}

	/** Runs one command; returns the process exit code. */
	int run(String[] args) {
		if (args.length == 0 || !isCommand(args[0])) {
			System.err.println(USAGE);
			return EXIT_USAGE;
		}
		String command = args[0];
		try {
			switch (command) {
			case "export-text":
				exportText();
				break;
			case "split-dump":
				splitDump();
				break;
			case "learn-mappings":
				learnMappings();
				break;
			case "validate":
				validate(args.length > 1 && "combined".equals(args[1]));
				break;
			default:
				learn();
			}
			Logger.info("End");
			return EXIT_OK;
		} catch (IOException | RuntimeException e) {
			Logger.error("{} failed: {}", e, command, e.getMessage());
			return EXIT_FAILED;
		}
	}

	static boolean isCommand(String s) {
		return List.of("export-text", "split-dump", "learn-mappings", "validate", "learn").contains(s);
	}

	private void exportText() throws IOException {
		int n = new FullTextExporter(new EdirGoldReader()).exportAll(Path.of(cfg.getTestGoldDir()),
				require(cfg.getFulltextDir(), "FULLTEXT_DIR"));
		Logger.info("{} text files written", n);
	}

	private void splitDump() throws IOException {
		int n = new AnnotationDumpSplitter().splitAll(require(cfg.getSemehrDumpDir(), "SEMEHR_DUMP_DIR"),
				Path.of(cfg.getTestAnnDir()));
		Logger.info("{} annotation records written", n);
	}

	private void learnMappings() throws IOException {
		ConceptMapping cm = ConceptMapping.load(Path.of(cfg.getConceptMappingFile()));
		MappingLearner learner = new MappingLearner(
				DirectoryCorpus.open(Path.of(cfg.getAnnDir()), Path.of(cfg.getGoldDir()), cm));
		learner.learn();
		learner.writeGazetteers(require(cfg.getGazetteerDir(), "GAZETTEER_DIR"), GAZETTEER_MAJOR_TYPE);
	}

	private void validate(boolean combined) throws IOException {
		LearningSettings s = settingsChecked();
		pipeline(s).populateValidationResults(s.getAnnDir(), s.getGoldDir(), combined);
	}

	private void learn() throws IOException {
		pipeline(settingsChecked()).runLearningExperiment();
	}

	private LearningSettings settingsChecked() {
		for (String issue : cfg.validate()) {
			Logger.warn(issue);
		}
		return cfg.toSettings();
	}

	private static PhenotypeLearningPipeline pipeline(LearningSettings s) throws IOException {
		return new PhenotypeLearningPipeline(s, ConceptMapping.load(s.getConceptMappingFile()),
				IgnoreMappings.load(s.getIgnoreMappingFile()));
	}

	private static Path require(String dir, String key) {
		if (dir == null)
			throw new IllegalStateException("Missing required property: " + key);
		return Path.of(dir);
	}
}
