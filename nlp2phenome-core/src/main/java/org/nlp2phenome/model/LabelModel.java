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

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.ObjectInputStream;
import java.io.ObjectOutputStream;
import java.io.Serializable;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

import org.nlp2phenome.om.ConceptMention;
import org.nlp2phenome.om.ContextedAnn;
import org.nlp2phenome.om.GoldDocument;
import org.nlp2phenome.om.LabelledEntity;
import org.nlp2phenome.om.Span;
import org.nlp2phenome.processing.load.LoadResult;
import org.nlp2phenome.processing.recognise.ContextMentions;
import org.nlp2phenome.processing.recognise.CustomisedRecogniser;
import org.nlp2phenome.util.Logger;

/**
 * Feature space for inferring one phenotype label from NLP output.
 * <p>
 * Two kinds of dimension are collected from a corpus:
 * <ul>
 * <li><b>label dimensions</b>: the literal of each mention evidencing the
 * label, registered once per distinct value;</li>
 * <li><b>context dimensions</b>: literals of the mentions around it, with a
 * running frequency and whether they were seen next to a true or a false
 * positive.</li>
 * </ul>
 * A mention is encoded as its label dimension (an index, or one-hot) followed
 * by two slots per selected context dimension: presence, and a frequency slot
 * that is always 0. Trained classifiers depend on that layout, so keep it.
 * <p>
 * Instances are serialisable; selections are cached per {@code k} and dropped
 * whenever a dimension is added.
 */
public class LabelModel implements Serializable {

	private static final long serialVersionUID = 1L;

	public static final int DEFAULT_MAX_DIMENSIONS = 2000;

	private final String label;
	private final List<String> contextDimensions = new ArrayList<>();
	private final List<String> labelDimensions = new ArrayList<>();
	private final Map<String, String> cui2label = new LinkedHashMap<>();
	private final Map<String, Integer> label2freq = new LinkedHashMap<>();
	private final Set<String> tpLabels = new HashSet<>();
	private final Set<String> fpLabels = new HashSet<>();
	private int tps;
	private int fps;
	private int maxDimensions = DEFAULT_MAX_DIMENSIONS;
	private boolean useOneDimensionForLabel = true;

	private transient Map<Integer, List<String>> frequencySelections;
	private transient Map<Integer, List<String>> weightedSelections;

	public LabelModel(String label) {
		this.label = label;
	}

	public LabelModel(String label, int maxDimensions) {
		this(label);
		this.maxDimensions = maxDimensions;
	}

	public String getLabel() {
		return label;
	}

	public List<String> getLabelDimensions() {
		return Collections.unmodifiableList(labelDimensions);
	}

	public List<String> getContextDimensions() {
		return Collections.unmodifiableList(contextDimensions);
	}

	/** Concept id to preferred term, for concepts seen in context. */
	public Map<String, String> getCui2label() {
		return Collections.unmodifiableMap(cui2label);
	}

	public int getFrequency(String dimension) {
		return label2freq.getOrDefault(dimension, 0);
	}

	public int getMaxDimensions() {
		return maxDimensions;
	}

	public void setMaxDimensions(int maxDimensions) {
		this.maxDimensions = maxDimensions;
	}

	public boolean isUseOneDimensionForLabel() {
		return useOneDimensionForLabel;
	}

	public void setUseOneDimensionForLabel(boolean useOneDimensionForLabel) {
		this.useOneDimensionForLabel = useOneDimensionForLabel;
	}

	public int getTruePositiveCount() {
		return tps;
	}

	public int getFalsePositiveCount() {
		return fps;
	}

	/** Sets the instance counts behind the weighted selection. */
	public void setInstanceCounts(int tps, int fps) {
		this.tps = tps;
		this.fps = fps;
		clearSelections();
	}

	// ---------- dimension accumulation ----------

	public void addLabelDimension(String value) {
		addLabelDimension(value, false, false);
	}

	/** Registers a label dimension once; TP/FP flags apply only on first sight. */
	public void addLabelDimension(String value, boolean tp, boolean fp) {
		String v = value.toLowerCase(Locale.ROOT);
		if (labelDimensions.contains(v))
			return;
		labelDimensions.add(v);
		if (tp)
			tpLabels.add(v);
		if (fp)
			fpLabels.add(v);
	}

	public void addLabelDimensionByAnnotation(Span ann) {
		addLabelDimension(DimensionLabels.of(ann));
	}

	public void addContextDimension(String value) {
		addContextDimension(value, false, false);
	}

	/** Counts one occurrence of a context dimension, registering it on first sight. */
	public void addContextDimension(String value, boolean tp, boolean fp) {
		String v = value.toLowerCase(Locale.ROOT);
		if (!label2freq.containsKey(v)) {
			contextDimensions.add(v);
			label2freq.put(v, 1);
		} else {
			label2freq.merge(v, 1, Integer::sum);
		}
		if (tp)
			tpLabels.add(v);
		if (fp)
			fpLabels.add(v);
		clearSelections();
	}

	public void addContextDimensionByAnnotation(Span ann, boolean tp, boolean fp) {
		addContextDimension(DimensionLabels.generalised(ann), tp, fp);
	}

	// ---------- dimension selection ----------

	/** The {@code k} most frequent context dimensions; ties keep insertion order. */
	public List<String> getTopFrequencyDimensions(int k) {
		return selections(false).computeIfAbsent(k, n -> label2freq.entrySet().stream()
				.sorted(Map.Entry.<String, Integer>comparingByValue().reversed())
				.limit(n)
				.map(Map.Entry::getKey)
				.collect(Collectors.toUnmodifiableList()));
	}

	/**
	 * The {@code k} context dimensions with the highest TP/FP-weighted score;
	 * ties keep insertion order. See {@link #weightedScore(String)}.
	 */
	public List<String> getTopWeightedDimensions(int k) {
		return selections(true).computeIfAbsent(k, n -> {
			Map<String, Double> scores = new LinkedHashMap<>();
			for (String l : label2freq.keySet()) {
				scores.put(l, weightedScore(l));
			}
			Logger.trace("dimension scores for {}: {}", label, scores);
			return scores.entrySet().stream()
					.sorted(Map.Entry.<String, Double>comparingByValue(Comparator.reverseOrder()))
					.limit(n)
					.map(Map.Entry::getKey)
					.collect(Collectors.toUnmodifiableList());
		});
	}

	/**
	 * Score of a context dimension.
	 * <p>
	 * With {@code w = tps / fps} (1 unless both are positive) and {@code idf}
	 * the reciprocal of the number of sets (TP, FP) the dimension belongs to:
	 * <ul>
	 * <li>in both sets: 0.0;</li>
	 * <li>in neither set: 0.0;</li>
	 * <li>{@code w == 1}: frequency x idf;</li>
	 * <li>FP only: frequency x w x idf;</li>
	 * <li>TP only: frequency.</li>
	 * </ul>
	 */
	public double weightedScore(String dimension) {
		boolean inTp = tpLabels.contains(dimension);
		boolean inFp = fpLabels.contains(dimension);
		int membership = (inTp ? 1 : 0) + (inFp ? 1 : 0);
		if (membership == 0 || (inTp && inFp))
			return 0.0;
		double idfWeight = (tps > 0 && fps > 0) ? (double) tps / fps : 1.0;
		double idf = 1.0 / membership;
		double score = getFrequency(dimension);
		if (idfWeight == 1.0)
			return score * idf;
		if (inFp)
			return score * idfWeight * idf;
		return score;
	}

	private Map<Integer, List<String>> selections(boolean weighted) {
		if (frequencySelections == null) {
			frequencySelections = new HashMap<>();
			weightedSelections = new HashMap<>();
		}
		return weighted ? weightedSelections : frequencySelections;
	}

	private void clearSelections() {
		frequencySelections = null;
		weightedSelections = null;
	}

	// ---------- encoding ----------

	/**
	 * Encodes a mention and its context window.
	 *
	 * @return label part (index, -1 if unseen, or one-hot) followed by
	 *         {@code [present, 0]} per selected context dimension
	 */
	public int[] encode(Span ann, List<? extends Span> context) {
		String annLabel = DimensionLabels.of(ann);
		List<String> dims = getTopWeightedDimensions(maxDimensions);
		int labelWidth = useOneDimensionForLabel ? 1 : labelDimensions.size();
		int[] encoded = new int[labelWidth + dims.size() * 2];
		int i = 0;
		if (useOneDimensionForLabel) {
			encoded[i++] = labelDimensions.indexOf(annLabel);
		} else {
			for (String lbl : labelDimensions) {
				encoded[i++] = lbl.equals(annLabel) ? 1 : 0;
			}
		}
		Set<String> contextLabels = context.stream().map(DimensionLabels::generalised).collect(Collectors.toSet());
		for (String l : dims) {
			encoded[i++] = contextLabels.contains(l) ? 1 : 0;
			// frequency slot, never filled
			encoded[i++] = 0;
		}
		return encoded;
	}

	// ---------- corpus passes ----------

	/**
	 * Frequency pass: registers label dimensions for both polarities of the
	 * label and counts the same-sentence context of mentions with the label's
	 * own polarity.
	 */
	public void collectDimensions(DocumentCorpus corpus) {
		String type = LabelledEntity.bareType(label);
		boolean negatedLabel = LabelledEntity.isNegatedLabel(label);
		for (String key : corpus.keys()) {
			LoadResult<CustomisedRecogniser> cr = corpus.recogniser(key);
			if (!cr.isFound())
				continue;
			for (ContextedAnn a : bothPolarities(cr.get(), type)) {
				addLabelDimensionByAnnotation(a);
				if (a.isNegated() != negatedLabel)
					continue;
				ContextMentions sanns = cr.get().getSameSentenceAnns(a);
				rememberPreferredTerms(sanns);
				for (ContextedAnn c : sanns.all()) {
					addContextDimensionByAnnotation(c, false, false);
				}
			}
		}
	}

	/**
	 * TP/FP pass: as {@link #collectDimensions(DocumentCorpus)} but over the
	 * prior-sentence context and only for documents with a gold standard. Each
	 * context dimension is flagged by whether its mention matched an unmatched
	 * gold entity of this label; the resulting TP/FP counts drive
	 * {@link #getTopWeightedDimensions(int)}.
	 */
	public void collectWeightedDimensions(DocumentCorpus corpus) {
		String type = LabelledEntity.bareType(label);
		boolean negatedLabel = LabelledEntity.isNegatedLabel(label);
		int tpFreq = 0;
		int fpFreq = 0;
		for (String key : corpus.keys()) {
			LoadResult<CustomisedRecogniser> cr = corpus.recogniser(key);
			LoadResult<GoldDocument> gd = corpus.gold(key);
			if (!cr.isFound() || !gd.isFound())
				continue;
			List<LabelledEntity> gold = gd.get().getEssEntities();
			Set<String> notMatched = goldIdsOfLabel(gold);

			for (ContextedAnn a : bothPolarities(cr.get(), type)) {
				addLabelDimensionByAnnotation(a);
				if (a.isNegated() != negatedLabel)
					continue;
				boolean matched = false;
				for (LabelledEntity g : gold) {
					if (notMatched.contains(g.getId()) && g.overlap(a) && label.equals(g.getLabel())) {
						matched = true;
						tpFreq++;
						notMatched.remove(g.getId());
					}
				}
				if (!matched)
					fpFreq++;

				ContextMentions sanns = cr.get().getPriorAnns(a);
				rememberPreferredTerms(sanns);
				for (ContextedAnn c : sanns.all()) {
					addContextDimensionByAnnotation(c, matched, !matched);
				}
			}
		}
		setInstanceCounts(tpFreq, fpFreq);
		Logger.debug("{} tp: {}, fp: {}", label, tpFreq, fpFreq);
	}

	public TrainingData loadData(DocumentCorpus corpus) {
		return loadData(corpus, Collections.emptyList());
	}

	/**
	 * Builds one example per mention evidencing the label in documents that have
	 * a gold standard.
	 * <p>
	 * Gold entities of the label are matched greedily in document order. A
	 * mention is labelled 1 when it claims at least one still unmatched gold
	 * entity. The multiple true positive count grows when a mention claims a
	 * second entity, and when it overlaps only entities already claimed by
	 * earlier mentions. Entities left unmatched are counted as false negatives.
	 */
	public TrainingData loadData(DocumentCorpus corpus, List<String> ignoreMappings) {
		List<int[]> x = new ArrayList<>();
		List<Integer> y = new ArrayList<>();
		int falseNegatives = 0;
		int multipleTruePositives = 0;
		for (String key : corpus.keys()) {
			LoadResult<CustomisedRecogniser> cr = corpus.recogniser(key);
			LoadResult<GoldDocument> gd = corpus.gold(key);
			if (!cr.isFound() || !gd.isFound())
				continue;
			List<LabelledEntity> gold = gd.get().getEssEntities();
			Set<String> notMatched = goldIdsOfLabel(gold);

			for (ContextedAnn a : cr.get().getAnnsByLabel(label, ignoreMappings)) {
				List<ContextedAnn> context = cr.get().getPriorAnns(a).all();
				boolean matched = false;
				boolean overlapsClaimed = false;
				for (LabelledEntity g : gold) {
					if (!label.equals(g.getLabel()) || !g.overlap(a))
						continue;
					if (notMatched.contains(g.getId())) {
						if (matched)
							multipleTruePositives++;
						matched = true;
						notMatched.remove(g.getId());
					} else {
						overlapsClaimed = true;
					}
				}
				if (!matched && overlapsClaimed)
					multipleTruePositives++;
				if (Logger.isEnabled(Logger.Level.DEBUG)) {
					Logger.debug("{} {} // {} {}", matched ? "R" : "!", DimensionLabels.of(a),
							context.stream().map(DimensionLabels::generalised).collect(Collectors.joining(" | ")),
							key);
				}
				y.add(matched ? 1 : 0);
				x.add(encode(a, context));
			}
			falseNegatives += notMatched.size();
			for (LabelledEntity g : gold) {
				if (notMatched.contains(g.getId()))
					Logger.debug("M\t{}\t{}\t{}\t{}\t{}", g.getText(), g.isNegated(), g.getStart(), g.getEnd(), key);
			}
		}
		return new TrainingData(x, y, falseNegatives, multipleTruePositives);
	}

	private Set<String> goldIdsOfLabel(List<LabelledEntity> gold) {
		Set<String> ids = new LinkedHashSet<>();
		for (LabelledEntity e : gold) {
			if (label.equals(e.getLabel()))
				ids.add(e.getId());
		}
		return ids;
	}

	private static List<ContextedAnn> bothPolarities(CustomisedRecogniser cr, String type) {
		List<ContextedAnn> anns = new ArrayList<>(cr.getAnnsByLabel(type));
		anns.addAll(cr.getAnnsByLabel(LabelledEntity.NEG_PREFIX + type));
		return anns;
	}

	private void rememberPreferredTerms(ContextMentions mentions) {
		for (ConceptMention u : mentions.getUmls()) {
			cui2label.put(u.getCui(), u.getPref());
		}
	}

	// ---------- persistence ----------

	/** Writes the model as gzip-compressed Java serialisation. */
	public void serialise(Path file) throws IOException {
		if (file.getParent() != null)
			Files.createDirectories(file.getParent());
		try (ObjectOutputStream out = new ObjectOutputStream(
				new BufferedOutputStream(new GZIPOutputStream(Files.newOutputStream(file))))) {
			out.writeObject(this);
		}
	}

	public static LabelModel deserialise(Path file) throws IOException {
		try (ObjectInputStream in = new ObjectInputStream(
				new BufferedInputStream(new GZIPInputStream(Files.newInputStream(file))))) {
			return (LabelModel) in.readObject();
		} catch (ClassNotFoundException | ClassCastException e) {
			throw new IOException("Not a label model: " + file, e);
		}
	}
}
