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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Per-document output of the semantic annotator: concept mentions, phenotype
 * mentions and sentence boundaries, each in document order.
 */
public class SemEhrDocument {

	private final List<ConceptMention> mentions;
	private final List<PhenotypeMention> phenotypes;
	private final List<SentenceSpan> sentences;
	private final List<OtherAnnotation> others;

	public SemEhrDocument(List<ConceptMention> mentions, List<PhenotypeMention> phenotypes,
			List<SentenceSpan> sentences, List<OtherAnnotation> others) {
		this.mentions = Collections.unmodifiableList(new ArrayList<>(mentions));
		this.phenotypes = Collections.unmodifiableList(new ArrayList<>(phenotypes));
		this.sentences = Collections.unmodifiableList(new ArrayList<>(sentences));
		this.others = Collections.unmodifiableList(new ArrayList<>(others));
	}

	public List<ConceptMention> getMentions() {
		return mentions;
	}

	public List<PhenotypeMention> getPhenotypes() {
		return phenotypes;
	}

	public List<SentenceSpan> getSentences() {
		return sentences;
	}

	public List<OtherAnnotation> getOthers() {
		return others;
	}

	/**
	 * Learns candidate concept-to-label mappings from a gold document.
	 * <p>
	 * For every gold entity, each concept mention that overlaps it and is not
	 * strictly contained by it contributes a {@code cui\tpref\tsty} triple under
	 * the entity's type. The entity's lower-cased literal is then recorded as a
	 * "missed" candidate whether or not a concept matched; curators prune this
	 * superset by hand.
	 *
	 * @param gold       gold-standard document for the same text
	 * @param lbl2insts  label -> concept triples (updated in place)
	 * @param lbl2missed label -> literal strings (updated in place)
	 */
	public void learnMappings(GoldDocument gold, Map<String, Set<String>> lbl2insts,
			Map<String, List<String>> lbl2missed) {
		for (LabelledEntity e : gold.getEssEntities()) {
			for (ConceptMention a : mentions) {
				if (a.overlap(e) && !e.isLarger(a)) {
					lbl2insts.computeIfAbsent(e.getType(), k -> new LinkedHashSet<>())
							.add(String.join("\t", a.getCui(), a.getPref(), a.getSty()));
				}
			}
			// recorded unconditionally, matched or not
			lbl2missed.computeIfAbsent(e.getType(), k -> new ArrayList<>())
					.add(e.getText().toLowerCase(Locale.ROOT));
		}
	}
}
