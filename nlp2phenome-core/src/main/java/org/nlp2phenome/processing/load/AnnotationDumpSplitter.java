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

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import org.apache.commons.lang3.StringUtils;
import org.nlp2phenome.util.Logger;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Splits SemEHR dump files (one JSON document per line, each with a
 * {@code docId}) into per-document annotation records named
 * {@code <docId without extension>.json}.
 */
public class AnnotationDumpSplitter {

	private final ObjectMapper mapper = new ObjectMapper();

	/**
	 * @return number of per-document records written
	 */
	public int splitAll(Path dumpFolder, Path outputFolder) throws IOException {
		List<Path> dumps;
		try (Stream<Path> s = Files.list(dumpFolder)) {
			dumps = s.filter(Files::isRegularFile).sorted().collect(Collectors.toList());
		}
		Files.createDirectories(outputFolder);
		int written = 0;
		for (Path d : dumps) {
			written += split(d, outputFolder);
		}
		Logger.info("{} document annotation records written to {}", written, outputFolder);
		return written;
	}

	public int split(Path dump, Path outputFolder) throws IOException {
		int written = 0;
		int lineNo = 0;
		try (BufferedReader br = Files.newBufferedReader(dump, StandardCharsets.UTF_8)) {
			String line;
			while ((line = br.readLine()) != null) {
				lineNo++;
				if (StringUtils.isBlank(line))
					continue;
				JsonNode doc;
				try {
					doc = mapper.readTree(line);
				} catch (JsonProcessingException e) {
					Logger.warn("Malformed JSON on line {} of {}: {}", lineNo, dump, e.getOriginalMessage());
					continue;
				}
				String docId = doc.path("docId").asText("");
				if (docId.isEmpty()) {
					Logger.warn("No docId on line {} of {}", lineNo, dump);
					continue;
				}
				String key = StringUtils.substringBefore(docId, ".");
				Files.writeString(outputFolder.resolve(key + ".json"), line, StandardCharsets.UTF_8);
				written++;
			}
		}
		return written;
	}
}
