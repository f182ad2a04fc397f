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

import java.nio.file.Path;
import java.util.function.Function;

/**
 * Outcome of reading an external record. Separates "the record is missing"
 * from "the record was found and holds no annotations", which an empty
 * collection alone cannot express.
 *
 * @param <T> the parsed document type
 */
public final class LoadResult<T> {

	public enum Status {
		FOUND, NOT_FOUND, UNREADABLE
	}

	private final Status status;
	private final Path source;
	private final T value;
	private final Exception cause;

	private LoadResult(Status status, Path source, T value, Exception cause) {
		this.status = status;
		this.source = source;
		this.value = value;
		this.cause = cause;
	}

	public static <T> LoadResult<T> found(Path source, T value) {
		return new LoadResult<>(Status.FOUND, source, value, null);
	}

	public static <T> LoadResult<T> notFound(Path source) {
		return new LoadResult<>(Status.NOT_FOUND, source, null, null);
	}

	public static <T> LoadResult<T> unreadable(Path source, Exception cause) {
		return new LoadResult<>(Status.UNREADABLE, source, null, cause);
	}

	public Status getStatus() {
		return status;
	}

	public boolean isFound() {
		return status == Status.FOUND;
	}

	public Path getSource() {
		return source;
	}

	/** Null unless {@link Status#UNREADABLE}. */
	public Exception getCause() {
		return cause;
	}

	/**
	 * @return the parsed value
	 * @throws IllegalStateException if the record was not found or unreadable
	 */
	public T get() {
		if (!isFound()) {
			throw new IllegalStateException("No document loaded from " + source + " (" + status + ")");
		}
		return value;
	}

	/** Applies {@code fn} to a found value; other statuses carry over unchanged. */
	public <R> LoadResult<R> map(Function<? super T, ? extends R> fn) {
		if (isFound()) {
			R mapped = fn.apply(value);
			return found(source, mapped);
		}
		return new LoadResult<>(status, source, null, cause);
	}

	public T orElse(T other) {
		return isFound() ? value : other;
	}

	@Override
	public String toString() {
		return "LoadResult[" + status + ", " + source + "]";
	}
}
