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

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.nlp2phenome.om.AnnotationKind;
import org.nlp2phenome.om.ConceptMention;
import org.nlp2phenome.om.Negation;
import org.nlp2phenome.om.OtherAnnotation;
import org.nlp2phenome.om.PhenotypeMention;
import org.nlp2phenome.om.SemEhrDocument;
import org.nlp2phenome.om.SentenceSpan;
import org.nlp2phenome.util.Logger;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Reads a per-document SemEHR annotation record (JSON).
 *
 * <pre>
 * { "annotations": [ [ { "type": "Mention",
 *                        "startNode": {"offset": 10}, "endNode": {"offset": 15},
 *                        "features": { "string_orig": "...", "Negation": "Affirmed", ... } } ] ] }
 * </pre>
 *
 * Mentions, phenotypes and sentences are numbered per kind in record order
 * ({@code cui-1}, {@code phe-1}, {@code sent-1}, ...). Records of any other
 * type are kept verbatim.
 */
public class SemEhrAnnotationReader {

	private final ObjectMapper mapper;

	public SemEhrAnnotationReader() {
		this(new ObjectMapper());
	}

	public SemEhrAnnotationReader(ObjectMapper mapper) {
		this.mapper = mapper;
	}

	public LoadResult<SemEhrDocument> read(Path file) {
		if (file == null || !Files.isRegularFile(file)) {
			Logger.debug("Annotation record not found: {}", file);
			return LoadResult.notFound(file);
		}
		try {
			return LoadResult.found(file, parse(mapper.readTree(file.toFile())));
		} catch (IOException | RuntimeException e) {
			Logger.warn("Unable to read annotation record {}: {}", file, e.getMessage());
			return LoadResult.unreadable(file, e);
		}
	}

	/** Builds a document from an already parsed record. */
	public SemEhrDocument parse(JsonNode root) {
		List<ConceptMention> mentions = new ArrayList<>();
		List<PhenotypeMention> phenotypes = new ArrayList<>();
		List<SentenceSpan> sentences = new ArrayList<>();
		List<OtherAnnotation> others = new ArrayList<>();

		for (JsonNode group : root.path("annotations")) {
			for (JsonNode ann : group) {
				String type = ann.path("type").asText(null);
				AnnotationKind kind = AnnotationKind.fromRecordType(type);
				if (kind == null) {
					others.add(new OtherAnnotation(type, ann));
					continue;
				}
				int start = ann.path("startNode").path("offset").asInt();
				int end = ann.path("endNode").path("offset").asInt();
				JsonNode f = ann.path("features");
				switch (kind) {
				case CONCEPT_MENTION:
					mentions.add(new ConceptMention(f.path("string_orig").asText(""), start, end,
							kind.idFor(mentions.size() + 1),
							Negation.parse(text(f, "Negation")), text(f, "Temporality"), text(f, "Experiencer"),
							text(f, "inst"), text(f, "STY"), text(f, "PREF")));
					break;
				case PHENOTYPE_MENTION:
					phenotypes.add(new PhenotypeMention(f.path("string_orig").asText(""), start, end,
							kind.idFor(phenotypes.size() + 1),
							Negation.parse(text(f, "Negation")), text(f, "Temporality"), text(f, "Experiencer"),
							text(f, "majorType"), text(f, "minorType")));
					break;
				case SENTENCE:
					sentences.add(new SentenceSpan(start, end, kind.idFor(sentences.size() + 1)));
					break;
				default:
					others.add(new OtherAnnotation(type, ann));
				}
			}
		}
		return new SemEhrDocument(mentions, phenotypes, sentences, others);
	}

	private static String text(JsonNode features, String field) {
		JsonNode n = features.get(field);
		return (n == null || n.isNull()) ? null : n.asText();
	}
}
