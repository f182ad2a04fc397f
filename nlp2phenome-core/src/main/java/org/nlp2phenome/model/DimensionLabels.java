package org.nlp2phenome.model;

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

import java.util.Locale;

import org.nlp2phenome.om.ContextedAnn;
import org.nlp2phenome.om.LabelledEntity;
import org.nlp2phenome.om.Span;

/**
 * Turns annotations into dimension strings: the lower-cased literal, prefixed
 * with {@code neg_} when the annotation is negated.
 */
public final class DimensionLabels {

	private DimensionLabels() {
	}

	public static String of(Span ann) {
		return (isNegated(ann) ? LabelledEntity.NEG_PREFIX : "") + ann.getText().toLowerCase(Locale.ROOT);
	}

	/** Form used for context dimensions. Same as {@link #of(Span)} for now. */
	public static String generalised(Span ann) {
		return of(ann);
	}

	static boolean isNegated(Span ann) {
		if (ann instanceof ContextedAnn)
			return ((ContextedAnn) ann).isNegated();
		if (ann instanceof LabelledEntity)
			return ((LabelledEntity) ann).isNegated();
		return false;
	}
}
