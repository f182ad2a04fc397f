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

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import org.apache.commons.lang3.StringUtils;
import org.nlp2phenome.om.GoldDocument;
import org.nlp2phenome.processing.load.EdirGoldReader;
import org.nlp2phenome.processing.load.LoadResult;
import org.nlp2phenome.processing.load.SemEhrAnnotationReader;
import org.nlp2phenome.processing.recognise.CustomisedRecogniser;
import org.nlp2phenome.umls.ConceptMapping;

/**
 * Corpus backed by two folders: {@code <annDir>/<key>.json} annotation records
 * and {@code <goldDir>/<key>-ann.xml} gold documents. The key is the record
 * file name up to its first dot.
 */
public class DirectoryCorpus implements DocumentCorpus {

	public static final String ANN_SUFFIX = ".json";
	public static final String GOLD_SUFFIX = "-ann.xml";

	private final Path annDir;
	private final Path goldDir;
	private final ConceptMapping conceptMapping;
	private final SemEhrAnnotationReader annReader;
	private final EdirGoldReader goldReader;
	private final List<String> keys;

	DirectoryCorpus(Path annDir, Path goldDir, ConceptMapping conceptMapping, SemEhrAnnotationReader annReader,
			EdirGoldReader goldReader, List<String> keys) {
		this.annDir = annDir;
		this.goldDir = goldDir;
		this.conceptMapping = conceptMapping;
		this.annReader = annReader;
		this.goldReader = goldReader;
		this.keys = keys;
	}

	/**
	 * Lists the annotation folder once; keys are sorted.
	 *
	 * @param goldDir may be null when only annotations are needed
	 * @throws IOException if {@code annDir} cannot be listed
	 */
	public static DirectoryCorpus open(Path annDir, Path goldDir, ConceptMapping conceptMapping) throws IOException {
		List<String> keys;
		try (Stream<Path> files = Files.list(annDir)) {
			keys = files.filter(Files::isRegularFile)
					.map(p -> p.getFileName().toString())
					.filter(n -> n.endsWith(ANN_SUFFIX))
					.map(n -> StringUtils.substringBefore(n, "."))
					.distinct()
					.sorted()
					.collect(Collectors.toList());
		}
		return new DirectoryCorpus(annDir, goldDir, conceptMapping, new SemEhrAnnotationReader(),
				new EdirGoldReader(), Collections.unmodifiableList(keys));
	}

	@Override
	public List<String> keys() {
		return keys;
	}

	@Override
	public LoadResult<CustomisedRecogniser> recogniser(String key) {
		return annReader.read(annDir.resolve(key + ANN_SUFFIX))
				.map(doc -> new CustomisedRecogniser(doc, conceptMapping));
	}

	@Override
	public LoadResult<GoldDocument> gold(String key) {
		if (goldDir == null)
			return LoadResult.notFound(null);
		return goldReader.read(goldDir.resolve(key + GOLD_SUFFIX));
	}

	public Path getAnnDir() {
		return annDir;
	}

	public Path getGoldDir() {
		return goldDir;
	}
}
