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

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.nlp2phenome.util.Logger;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Maps UMLS concept ids to the target phenotype labels they indicate, and to
 * a human-readable preferred term.
 * <p>
 * The source table maps each label to tab-joined strings
 * ({@code C0038454\tStroke\t...}); the first {@value #CUI_LENGTH} characters
 * are the concept id and the second field is the preferred term. When a
 * concept appears under several entries, the last preferred term read wins.
 * Immutable once built.
 */
public final class ConceptMapping {

	static final int CUI_LENGTH = 8;

	private final Map<String, List<String>> concept2label;
	private final Map<String, String> cui2label;

	private ConceptMapping(Map<String, List<String>> concept2label, Map<String, String> cui2label) {
		this.concept2label = concept2label;
		this.cui2label = cui2label;
	}

	/**
	 * Load the mapping table.
	 *
	 * @throws IllegalArgumentException if the file is missing
	 * @throws IOException              if the JSON cannot be read
	 */
	public static ConceptMapping load(Path file) throws IOException {
		if (file == null || !Files.isReadable(file)) {
			throw new IllegalArgumentException("Concept mapping file is null or not readable: " + file);
		}
		Map<String, List<String>> table = new ObjectMapper().readValue(file.toFile(),
				new TypeReference<LinkedHashMap<String, List<String>>>() {
				});
		ConceptMapping cm = fromTable(table);
		Logger.info("Concept mapping loaded: {} concepts, {} labels", cm.concept2label.size(), table.size());
		return cm;
	}

	/** Builds the inverse (concept -> labels) from a label -> entries table. */
	public static ConceptMapping fromTable(Map<String, ? extends Iterable<String>> table) {
		Map<String, List<String>> concept2types = new LinkedHashMap<>();
		Map<String, String> cui2label = new LinkedHashMap<>();
		for (Map.Entry<String, ? extends Iterable<String>> e : table.entrySet()) {
			String label = e.getKey();
			for (String text : e.getValue()) {
				String cui = text.length() > CUI_LENGTH ? text.substring(0, CUI_LENGTH) : text;
				String[] arr = text.split("\t");
				if (arr.length > 1) {
					cui2label.put(cui, arr[1]);
				} else {
					Logger.debug("No preferred term in concept mapping entry '{}'", text);
				}
				List<String> labels = concept2types.computeIfAbsent(cui, k -> new ArrayList<>());
				if (!labels.contains(label)) {
					labels.add(label);
				}
			}
		}
		concept2types.replaceAll((k, v) -> Collections.unmodifiableList(v));
		return new ConceptMapping(Collections.unmodifiableMap(concept2types),
				Collections.unmodifiableMap(cui2label));
	}

	public boolean isMapped(String cui) {
		return cui != null && concept2label.containsKey(cui);
	}

	/** Labels for a concept id, empty when unmapped. */
	public List<String> labelsOf(String cui) {
		List<String> labels = (cui == null) ? null : concept2label.get(cui);
		return labels == null ? Collections.emptyList() : labels;
	}

	/** Preferred term for a concept id, or null. */
	public String preferredTerm(String cui) {
		return cui2label.get(cui);
	}

	public Map<String, String> getCui2label() {
		return cui2label;
	}
}
