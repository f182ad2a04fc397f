package org.nlp2phenome.processing.load;

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
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import org.nlp2phenome.om.GoldDocument;
import org.nlp2phenome.util.Logger;

/**
 * Recovers the plain text of gold-standard documents so it can be fed to the
 * semantic annotator: {@code <name>-ann.xml} becomes {@code <name>.txt}.
 */
public class FullTextExporter {

	static final String GOLD_SUFFIX = "-ann.xml";

	private final EdirGoldReader reader;

	public FullTextExporter(EdirGoldReader reader) {
		this.reader = reader;
	}

	/**
	 * @return number of text files written
	 */
	public int exportAll(Path goldDir, Path outputDir) throws IOException {
		List<Path> xmlFiles;
		try (Stream<Path> s = Files.list(goldDir)) {
			xmlFiles = s.filter(p -> p.getFileName().toString().endsWith(GOLD_SUFFIX)).sorted()
					.collect(Collectors.toList());
		}
		Files.createDirectories(outputDir);
		int written = 0;
		for (Path xml : xmlFiles) {
			if (export(xml, outputDir)) {
				written++;
			}
		}
		return written;
	}

	public boolean export(Path xmlFile, Path outputDir) throws IOException {
		LoadResult<GoldDocument> gold = reader.read(xmlFile);
		if (!gold.isFound()) {
			return false;
		}
		String fn = xmlFile.getFileName().toString();
		String name = fn.replace(GOLD_SUFFIX, ".txt");
		Files.writeString(outputDir.resolve(name), gold.get().getFullText(), StandardCharsets.UTF_8);
		Logger.info("{} processed to be {}", fn, name);
		return true;
	}
}
