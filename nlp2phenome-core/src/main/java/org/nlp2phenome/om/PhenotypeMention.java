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
 * A phenotype mention detected directly by customised annotator rules; the
 * minor type names the target label.
 */
@Value
@With
public class PhenotypeMention implements ContextedAnn {

	String text;
	int start;
	int end;
	String id;

	Negation negation;
	String temporality;
	String experiencer;

	String majorType;
	String minorType;

	@Override
	public AnnotationKind getKind() {
		return AnnotationKind.PHENOTYPE_MENTION;
	}
}
