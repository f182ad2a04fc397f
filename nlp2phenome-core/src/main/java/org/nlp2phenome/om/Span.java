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
 * A character-offset interval with its literal text. Offsets are half-open
 * ({@code [start, end)}) in character units; callers guarantee
 * {@code start <= end}, nothing here reorders them.
 * <p>
 * Every annotation kind (gold entity, concept mention, phenotype mention,
 * sentence) shares this capability; {@link #getKind()} is the tag used to
 * dispatch on the concrete variant.
 */
public interface Span {

	/** Literal text covered by the span. */
	String getText();

	int getStart();

	int getEnd();

	/** Identifier assigned by the owning document, e.g. {@code cui-3}. */
	String getId();

	AnnotationKind getKind();

	/**
	 * True iff either span's start or end offset lies within the other's closed
	 * interval {@code [start, end]}. Zero-length spans overlap any span whose
	 * bounds include their single point.
	 */
	default boolean overlap(Span other) {
		return within(getStart(), other) || within(getEnd(), other)
				|| within(other.getStart(), this) || within(other.getEnd(), this);
	}

	/**
	 * True iff this span contains {@code other} and the two intervals are not
	 * identical.
	 */
	default boolean isLarger(Span other) {
		return getStart() <= other.getStart() && getEnd() >= other.getEnd()
				&& !(getStart() == other.getStart() && getEnd() == other.getEnd());
	}

	private static boolean within(int offset, Span s) {
		return s.getStart() <= offset && offset <= s.getEnd();
	}
}
