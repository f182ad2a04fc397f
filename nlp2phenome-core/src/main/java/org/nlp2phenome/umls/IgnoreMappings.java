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
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.nlp2phenome.om.LabelledEntity;
import org.nlp2phenome.util.Logger;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Per-label exclusions: concept ids or literal strings whose mentions must not
 * be taken as evidence for a label. Keyed by bare label type.
 */
public final class IgnoreMappings {

	private static final IgnoreMappings EMPTY = new IgnoreMappings(Collections.emptyMap());

	private final Map<String, List<String>> byType;

	public IgnoreMappings(Map<String, List<String>> byType) {
		this.byType = Collections.unmodifiableMap(new LinkedHashMap<>(byType));
	}

	public static IgnoreMappings empty() {
		return EMPTY;
	}

	/** Reads the JSON table; a null or missing path yields no exclusions. */
	public static IgnoreMappings load(Path file) throws IOException {
		if (file == null || !Files.isRegularFile(file)) {
			Logger.info("No ignore mapping file found ({}); nothing is excluded", file);
			return EMPTY;
		}
		Map<String, List<String>> table = new ObjectMapper().readValue(file.toFile(),
				new TypeReference<LinkedHashMap<String, List<String>>>() {
				});
		return new IgnoreMappings(table);
	}

	/** Exclusions for a label; any {@code neg_} marker is ignored. */
	public List<String> forLabel(String label) {
		List<String> l = byType.get(LabelledEntity.bareType(label));
		return l == null ? Collections.emptyList() : l;
	}
}
