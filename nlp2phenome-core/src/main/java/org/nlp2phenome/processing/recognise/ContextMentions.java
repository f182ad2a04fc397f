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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.nlp2phenome.om.ConceptMention;
import org.nlp2phenome.om.ContextedAnn;
import org.nlp2phenome.om.PhenotypeMention;

import lombok.Value;

/**
 * Mentions found in a context window, split by kind.
 */
@Value
public class ContextMentions {

	private static final ContextMentions EMPTY = new ContextMentions(Collections.emptyList(),
			Collections.emptyList());

	List<ConceptMention> umls;
	List<PhenotypeMention> phenotypes;

	public static ContextMentions empty() {
		return EMPTY;
	}

	/** Concept mentions first, then phenotype mentions. */
	public List<ContextedAnn> all() {
		List<ContextedAnn> all = new ArrayList<>(umls.size() + phenotypes.size());
		all.addAll(umls);
		all.addAll(phenotypes);
		return all;
	}

	public boolean isEmpty() {
		return umls.isEmpty() && phenotypes.isEmpty();
	}
}
