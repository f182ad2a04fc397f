package org.nlp2phenome.om;

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

/**
 * Variant tag for {@link Span} implementations. Kinds read from an automated
 * annotation record carry the record type name and the id prefix used when
 * numbering them within a document.
 */
public enum AnnotationKind {

	/** Hand-curated entity from a gold-standard document. */
	GOLD_ENTITY(null, null),

	/** Detected mention re-typed under a target label during reconciliation. */
	LABELLED(null, null),

	CONCEPT_MENTION("Mention", "cui"),

	PHENOTYPE_MENTION("Phenotype", "phe"),

	SENTENCE("Sentence", "sent");

	private final String recordType;
	private final String idPrefix;

	AnnotationKind(String recordType, String idPrefix) {
		this.recordType = recordType;
		this.idPrefix = idPrefix;
	}

	/** Builds the per-document id, e.g. {@code phe-2}. */
	public String idFor(int n) {
		return idPrefix + "-" + n;
	}

	/** Resolves an annotation record {@code type} field; null when unrecognised. */
	public static AnnotationKind fromRecordType(String type) {
		if (type == null)
			return null;
		for (AnnotationKind k : values()) {
			if (type.equals(k.recordType))
				return k;
		}
		return null;
	}
}
