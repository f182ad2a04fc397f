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

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.nlp2phenome.model.DocumentCorpus;
import org.nlp2phenome.om.GoldDocument;
import org.nlp2phenome.processing.load.LoadResult;
import org.nlp2phenome.util.Logger;

import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Learns concept-to-label mappings from a gold-standard corpus and writes the
 * literal strings of gold entities as gazetteer lists ({@code <label>.lst}).
 * The output is a candidate set for manual curation.
 */
public class MappingLearner {

	public static final String GAZETTEER_SUFFIX = ".lst";

	private final DocumentCorpus corpus;
	private final ObjectMapper mapper;
	private final Map<String, Set<String>> lbl2insts = new LinkedHashMap<>();
	private final Map<String, List<String>> lbl2missed = new LinkedHashMap<>();

	public MappingLearner(DocumentCorpus corpus) {
		this(corpus, new ObjectMapper());
	}

	public MappingLearner(DocumentCorpus corpus, ObjectMapper mapper) {
		this.corpus = corpus;
		this.mapper = mapper;
	}

	/**
	 * Runs over every document that has both annotations and a gold standard,
	 * then logs the learnt label to concept table as JSON.
	 *
	 * @return number of documents used
	 * @throws IOException if the table cannot be rendered
	 */
	public int learn() throws IOException {
		int docs = 0;
		for (String key : corpus.keys()) {
			LoadResult<GoldDocument> gd = corpus.gold(key);
			if (!gd.isFound()) {
				Logger.debug("not a gold document: {}", gd.getSource());
				continue;
			}
			LoadResult<CustomisedRecogniser> cr = corpus.recogniser(key);
			if (!cr.isFound())
				continue;
			cr.get().getDocument().learnMappings(gd.get(), lbl2insts, lbl2missed);
			docs++;
		}
		Logger.info("concept mappings learnt from {} documents", docs);
		Logger.info("{}", mapper.writeValueAsString(lbl2insts));
		return docs;
	}

	/** Label to {@code cui\tpref\tsty} triples. */
	public Map<String, Set<String>> getConceptInstances() {
		return Collections.unmodifiableMap(lbl2insts);
	}

	/** Label to lower-cased gold strings, duplicates included. */
	public Map<String, List<String>> getMissed() {
		return Collections.unmodifiableMap(lbl2missed);
	}

	/**
	 * Writes one de-duplicated list per label and returns the gazetteer
	 * definitions ({@code <label>.lst:<majorType>:<label>}).
	 */
	public List<String> writeGazetteers(Path outputFolder, String majorType) throws IOException {
		Files.createDirectories(outputFolder);
		List<String> defs = new ArrayList<>();
		for (Map.Entry<String, List<String>> e : lbl2missed.entrySet()) {
			String label = e.getKey();
			Set<String> distinct = new LinkedHashSet<>(e.getValue());
			Files.writeString(outputFolder.resolve(label + GAZETTEER_SUFFIX), String.join("\n", distinct) + "\n",
					StandardCharsets.UTF_8);
			defs.add(label + GAZETTEER_SUFFIX + ":" + majorType + ":" + label);
		}
		Logger.info("gazetteer definitions:\n{}", String.join("\n", defs));
		return defs;
	}
}
