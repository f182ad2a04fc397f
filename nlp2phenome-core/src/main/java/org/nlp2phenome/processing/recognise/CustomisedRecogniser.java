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
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

import org.nlp2phenome.eval.LabelPerformance;
import org.nlp2phenome.om.ConceptMention;
import org.nlp2phenome.om.ContextedAnn;
import org.nlp2phenome.om.LabelledEntity;
import org.nlp2phenome.om.PhenotypeMention;
import org.nlp2phenome.om.SemEhrDocument;
import org.nlp2phenome.om.SentenceSpan;
import org.nlp2phenome.om.Span;
import org.nlp2phenome.umls.ConceptMapping;
import org.nlp2phenome.util.Logger;

/**
 * Recognises target labels in one annotated document, either through the
 * concept-to-label mapping or through phenotype mentions produced by
 * customised rules, and compares the result with gold-standard entities.
 * <p>
 * Derived lists are computed once and cached; the instance is not thread-safe.
 */
public class CustomisedRecogniser {

	private final SemEhrDocument document;
	private final ConceptMapping conceptMapping;

	private List<LabelledEntity> mapped;
	private List<LabelledEntity> phenotypes;
	private List<LabelledEntity> combined;

	public CustomisedRecogniser(SemEhrDocument document, ConceptMapping conceptMapping) {
		this.document = document;
		this.conceptMapping = conceptMapping;
	}

	public SemEhrDocument getDocument() {
		return document;
	}

	public ConceptMapping getConceptMapping() {
		return conceptMapping;
	}

	/**
	 * One labelled annotation per (mapped concept mention, label) pair, keeping
	 * the mention's id and negation.
	 */
	public List<LabelledEntity> getMappedLabels() {
		if (mapped != null)
			return mapped;
		List<LabelledEntity> out = new ArrayList<>();
		for (ConceptMention m : document.getMentions()) {
			for (String label : conceptMapping.labelsOf(m.getCui())) {
				out.add(LabelledEntity.labelled(m, label));
			}
		}
		mapped = Collections.unmodifiableList(out);
		return mapped;
	}

	/** Every phenotype mention re-typed under its minor type; untyped ones are skipped. */
	public List<LabelledEntity> getCustomisedPhenotypes() {
		if (phenotypes != null)
			return phenotypes;
		phenotypes = document.getPhenotypes().stream()
				.filter(p -> p.getMinorType() != null)
				.map(p -> LabelledEntity.labelled(p, p.getMinorType()))
				.collect(Collectors.toUnmodifiableList());
		return phenotypes;
	}

	/**
	 * Mapped labels plus the customised phenotypes that do not overlap any of
	 * them. Mapped labels win every overlap, whatever the span sizes.
	 */
	public List<LabelledEntity> getCombinedAnns() {
		if (combined != null)
			return combined;
		List<LabelledEntity> out = new ArrayList<>(getMappedLabels());
		for (LabelledEntity p : getCustomisedPhenotypes()) {
			boolean overlapped = getMappedLabels().stream().anyMatch(p::overlap);
			if (!overlapped)
				out.add(p);
		}
		combined = Collections.unmodifiableList(out);
		return combined;
	}

	/** First sentence, in document order, that overlaps {@code ann}. */
	public Optional<SentenceSpan> getAnnSentence(Span ann) {
		for (SentenceSpan s : document.getSentences()) {
			if (ann.overlap(s))
				return Optional.of(s);
		}
		Logger.debug("Sentence not found for {} '{}' [{}, {}]", ann.getId(), ann.getText(), ann.getStart(),
				ann.getEnd());
		return Optional.empty();
	}

	/**
	 * Sentences starting before the sentence of {@code ann}, in document order,
	 * optionally followed by that sentence itself. Empty when the mention falls
	 * outside every sentence.
	 */
	public List<SentenceSpan> getPreviousSentences(Span ann, boolean includeSelf) {
		Optional<SentenceSpan> own = getAnnSentence(ann);
		if (own.isEmpty())
			return Collections.emptyList();
		SentenceSpan sent = own.get();
		List<SentenceSpan> sents = new ArrayList<>();
		for (SentenceSpan s : document.getSentences()) {
			if (s.getStart() < sent.getStart())
				sents.add(s);
		}
		if (includeSelf)
			sents.add(sent);
		return sents;
	}

	/**
	 * Concept and phenotype mentions overlapping {@code sentence}, minus those
	 * overlapping {@code ignore} (which may be null).
	 */
	public ContextMentions getSentAnns(Span sentence, Span ignore) {
		List<ConceptMention> umls = new ArrayList<>();
		for (ConceptMention a : document.getMentions()) {
			if (a.overlap(sentence) && (ignore == null || !ignore.overlap(a)))
				umls.add(a);
		}
		List<PhenotypeMention> phe = new ArrayList<>();
		for (PhenotypeMention a : document.getPhenotypes()) {
			if (a.overlap(sentence) && (ignore == null || !ignore.overlap(a)))
				phe.add(a);
		}
		return new ContextMentions(umls, phe);
	}

	/** Mentions sharing the sentence of {@code ann}, excluding overlaps with it. */
	public ContextMentions getSameSentenceAnns(Span ann) {
		return getAnnSentence(ann)
				.map(s -> getSentAnns(s, ann))
				.orElse(ContextMentions.empty());
	}

	/**
	 * The context window used for features: the last element of
	 * {@code getPreviousSentences(ann, true)}, which is the mention's own
	 * sentence, minus the mention itself.
	 */
	public ContextMentions getPriorAnns(Span ann) {
		List<SentenceSpan> sents = getPreviousSentences(ann, true);
		if (sents.isEmpty())
			return ContextMentions.empty();
		return getSentAnns(sents.get(sents.size() - 1), ann);
	}

	public List<ContextedAnn> getAnnsByLabel(String label) {
		return getAnnsByLabel(label, Collections.emptyList());
	}

	/**
	 * Mentions evidencing {@code label}: concept mentions mapped to its bare type
	 * and phenotype mentions of that minor type, with the polarity the label
	 * asks for ({@code neg_} prefix means negated).
	 * <p>
	 * A concept mention is skipped when its concept id or its lower-cased text is
	 * in {@code ignoreMappings}; a phenotype mention when its lower-cased text
	 * is. A phenotype mention overlapping an already selected mention is dropped
	 * unless it is larger, in which case the smaller ones are removed instead.
	 * Order: concept mentions, then phenotype mentions, each in document order.
	 */
	public List<ContextedAnn> getAnnsByLabel(String label, List<String> ignoreMappings) {
		boolean wantNegated = LabelledEntity.isNegatedLabel(label);
		String type = LabelledEntity.bareType(label);
		Set<String> ignoredLower = ignoreMappings.stream()
				.map(s -> s.toLowerCase(Locale.ROOT))
				.collect(Collectors.toSet());

		List<ContextedAnn> anns = new ArrayList<>();
		for (ConceptMention a : document.getMentions()) {
			if (!conceptMapping.isMapped(a.getCui()) || ignoreMappings.contains(a.getCui())
					|| ignoredLower.contains(a.getText().toLowerCase(Locale.ROOT)))
				continue;
			if (conceptMapping.labelsOf(a.getCui()).contains(type) && a.isNegated() == wantNegated)
				anns.add(a);
		}

		List<ContextedAnn> phenotypeAnns = new ArrayList<>();
		Set<ContextedAnn> smallerToRemove = Collections.newSetFromMap(new IdentityHashMap<>());
		for (PhenotypeMention a : document.getPhenotypes()) {
			if (!type.equals(a.getMinorType()) || ignoredLower.contains(a.getText().toLowerCase(Locale.ROOT)))
				continue;
			if (a.isNegated() != wantNegated)
				continue;
			boolean overlapped = false;
			List<ContextedAnn> selected = new ArrayList<>(anns);
			selected.addAll(phenotypeAnns);
			for (ContextedAnn s : selected) {
				if (s.overlap(a)) {
					if (a.isLarger(s)) {
						smallerToRemove.add(s);
					} else {
						overlapped = true;
						break;
					}
				}
			}
			if (!overlapped)
				phenotypeAnns.add(a);
		}

		List<ContextedAnn> out = new ArrayList<>(anns.size() + phenotypeAnns.size());
		for (ContextedAnn a : anns) {
			if (!smallerToRemove.contains(a))
				out.add(a);
		}
		for (ContextedAnn a : phenotypeAnns) {
			if (!smallerToRemove.contains(a))
				out.add(a);
		}
		return out;
	}

	public void validateMappedPerformance(List<LabelledEntity> gold, Map<String, LabelPerformance> label2performance) {
		validate(gold, getMappedLabels(), label2performance);
	}

	public void validateCombinedPerformance(List<LabelledEntity> gold,
			Map<String, LabelPerformance> label2performance) {
		validate(gold, getCombinedAnns(), label2performance);
	}

	/**
	 * Greedy first-overlap matching of recognised annotations against gold
	 * entities, both walked in insertion order.
	 * <p>
	 * Each gold entity takes the first not yet matched annotation with the same
	 * label that overlaps it (true positive) or counts as a false negative.
	 * Annotations whose id was never matched count as false positives under
	 * their own label. Annotations derived from one mention share its id, so a
	 * match on one label also clears its siblings.
	 */
	public static void validate(List<LabelledEntity> gold, List<LabelledEntity> learnt,
			Map<String, LabelPerformance> label2performance) {
		boolean[] taken = new boolean[learnt.size()];
		Set<String> matchedIds = new HashSet<>();
		for (LabelledEntity ga : gold) {
			String l = ga.getLabel();
			LabelPerformance performance = label2performance.computeIfAbsent(l, LabelPerformance::new);
			boolean matched = false;
			for (int i = 0; i < learnt.size(); i++) {
				LabelledEntity la = learnt.get(i);
				if (!taken[i] && la.getLabel().equals(l) && la.overlap(ga)) {
					matched = true;
					taken[i] = true;
					matchedIds.add(la.getId());
					performance.increaseTruePositive();
					break;
				}
			}
			if (!matched)
				performance.increaseFalseNegative();
		}
		for (LabelledEntity la : learnt) {
			if (!matchedIds.contains(la.getId())) {
				label2performance.computeIfAbsent(la.getLabel(), LabelPerformance::new).increaseFalsePositive();
			}
		}
	}
}
