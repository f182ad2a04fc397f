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

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;

import org.apache.commons.lang3.StringUtils;
import org.nlp2phenome.om.GoldDocument;
import org.nlp2phenome.om.LabelledEntity;
import org.nlp2phenome.util.Logger;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;

/**
 * Reads an EDIR gold-standard annotation document (XML).
 * <p>
 * Text is held as {@code p/s/w} elements whose ids ({@code w123}) encode the
 * character offset of each word; entities live in {@code standoff/ents/ent},
 * each made of one or more {@code parts/part} elements whose {@code sw}
 * attribute names the starting word.
 * <ul>
 * <li>Entity types starting with {@code label:} are skipped.</li>
 * <li>Types containing {@code neg_} are negated; the marker is removed.</li>
 * <li>Offsets are relative to the first processed word id.</li>
 * <li>For multi-part entities the span is computed from the last part only;
 * the literal text joins all parts with a space.</li>
 * </ul>
 */
public class EdirGoldReader {

	private static final String LABEL_TYPE_PREFIX = "label:";

	public LoadResult<GoldDocument> read(Path file) {
		if (file == null || !Files.isRegularFile(file)) {
			Logger.debug("{} is NOT a file", file);
			return LoadResult.notFound(file);
		}
		try {
			Document doc = newSecureBuilder().parse(file.toFile());
			return LoadResult.found(file, parse(doc));
		} catch (Exception e) {
			Logger.warn("Unable to parse gold document {}: {}", file, e.getMessage());
			return LoadResult.unreadable(file, e);
		}
	}

	GoldDocument parse(Document doc) {
		Element root = doc.getDocumentElement();
		int offsetStart = wordOffsetStart(root);
		if (offsetStart == -1) {
			Logger.debug("offset start could not be found");
		}
		return new GoldDocument(offsetStart, essEntities(root, offsetStart), fullText(root));
	}

	// ------------------ Entities ------------------

	private List<LabelledEntity> essEntities(Element root, int offsetStart) {
		List<LabelledEntity> entities = new ArrayList<>();
		for (Element standoff : descendants(root, "standoff")) {
			for (Element ents : children(standoff, "ents")) {
				for (Element ent : children(ents, "ent")) {
					if (!ent.hasAttribute("type"))
						continue;
					String type = ent.getAttribute("type");
					if (type.startsWith(LABEL_TYPE_PREFIX))
						continue;
					boolean negated = false;
					if (type.contains(LabelledEntity.NEG_PREFIX)) {
						negated = true;
						type = type.replace(LabelledEntity.NEG_PREFIX, "");
					}

					List<String> texts = new ArrayList<>();
					int start = -1;
					int end = -1;
					for (Element parts : children(ent, "parts")) {
						for (Element part : children(parts, "part")) {
							String partText = part.getTextContent();
							texts.add(partText);
							// last part wins
							start = wordId(part.getAttribute("sw")) - offsetStart;
							end = start + partText.length();
						}
					}
					entities.add(LabelledEntity.gold(String.join(" ", texts), start, end, type, negated,
							String.valueOf(entities.size())));
				}
			}
		}
		return entities;
	}

	// ------------------ Words ------------------

	private int wordOffsetStart(Element root) {
		for (Element w : processedWords(root)) {
			if (w.hasAttribute("id")) {
				return wordId(w.getAttribute("id"));
			}
		}
		return -1;
	}

	/** Rebuilds the document text by padding each word out to its offset. */
	private String fullText(Element root) {
		StringBuilder d = new StringBuilder();
		int startOffset = -1;
		for (Element w : processedWords(root)) {
			if (!w.hasAttribute("id"))
				continue;
			int idVal = wordId(w.getAttribute("id"));
			if (startOffset == -1) {
				startOffset = idVal;
			}
			int offset = idVal - startOffset;
			if (offset > d.length()) {
				d.append(StringUtils.repeat(' ', offset - d.length()));
			}
			d.append(w.getTextContent());
		}
		return d.toString();
	}

	private List<Element> processedWords(Element root) {
		List<Element> words = new ArrayList<>();
		for (Element p : descendants(root, "p")) {
			for (Element s : children(p, "s")) {
				if (!s.hasAttribute("proc"))
					continue;
				words.addAll(children(s, "w"));
			}
		}
		return words;
	}

	/** {@code w123} -> 123 */
	private static int wordId(String raw) {
		return Integer.parseInt(raw.substring(1));
	}

	// ------------------ DOM helpers ------------------

	private static List<Element> descendants(Element el, String tag) {
		List<Element> out = new ArrayList<>();
		NodeList nl = el.getElementsByTagName(tag);
		for (int i = 0; i < nl.getLength(); i++) {
			out.add((Element) nl.item(i));
		}
		return out;
	}

	private static List<Element> children(Element el, String tag) {
		List<Element> out = new ArrayList<>();
		for (Node n = el.getFirstChild(); n != null; n = n.getNextSibling()) {
			if (n.getNodeType() == Node.ELEMENT_NODE && tag.equals(n.getNodeName())) {
				out.add((Element) n);
			}
		}
		return out;
	}

	/** Hardened DOM builder (XXE / DTD disabled). */
	private static DocumentBuilder newSecureBuilder() throws ParserConfigurationException {
		DocumentBuilderFactory f = DocumentBuilderFactory.newInstance();
		f.setNamespaceAware(false);
		f.setValidating(false);
		f.setXIncludeAware(false);
		f.setExpandEntityReferences(false);

		f.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
		f.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
		f.setFeature("http://xml.org/sax/features/external-general-entities", false);
		f.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
		f.setFeature("http://apache.org/xml/features/nonvalidating/load-external-dtd", false);
		return f.newDocumentBuilder();
	}
}
