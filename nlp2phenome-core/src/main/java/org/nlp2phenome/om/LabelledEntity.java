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

import lombok.Value;
import lombok.With;

/**
 * A span typed with a target phenotype label. Gold-standard entities and
 * reconciled (mapped or customised) mentions share this shape; they differ only
 * in {@link #getKind()}.
 */
@Value
@With
public class LabelledEntity implements Span {

	/** Prefix marking the negated form of a label, e.g. {@code neg_stroke}. */
	public static final String NEG_PREFIX = "neg_";

	String text;
	int start;
	int end;
	String id;
	String type;
	boolean negated;
	AnnotationKind kind;

	public static LabelledEntity gold(String text, int start, int end, String type, boolean negated, String id) {
		return new LabelledEntity(text, start, end, id, type, negated, AnnotationKind.GOLD_ENTITY);
	}

	/** Re-types a detected mention under {@code type}, keeping its id and polarity. */
	public static LabelledEntity labelled(ContextedAnn source, String type) {
		return new LabelledEntity(source.getText(), source.getStart(), source.getEnd(), source.getId(), type,
				source.isNegated(), AnnotationKind.LABELLED);
	}

	/** The type, prefixed with {@value #NEG_PREFIX} when negated. */
	public String getLabel() {
		return negated ? NEG_PREFIX + type : type;
	}

	public static boolean isNegatedLabel(String label) {
		return label.startsWith(NEG_PREFIX);
	}

	/** Strips every {@value #NEG_PREFIX} marker from a label. */
	public static String bareType(String label) {
		return label.replace(NEG_PREFIX, "");
	}
}
