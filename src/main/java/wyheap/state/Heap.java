// Copyright 2020 The Whiley Project Developers
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//    http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
package wyheap.state;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/**
 * An immutable, ordered collection of chunks.
 *
 * @author David J. Pearce
 *
 */
public class Heap implements Iterable<Chunk> {
	public static final Heap EMPTY = new Heap(Collections.emptyList());

	private final List<Chunk> chunks;

	public Heap(List<Chunk> chunks) {
		this.chunks = Collections.unmodifiableList(new ArrayList<>(chunks));
	}

	public List<Chunk> values() {
		return chunks;
	}

	public int size() {
		return chunks.size();
	}

	public boolean isEmpty() {
		return chunks.isEmpty();
	}

	/**
	 * Return a heap containing all chunks of this heap, followed by a given
	 * chunk.
	 *
	 * @param chunk
	 * @return
	 */
	public Heap add(Chunk chunk) {
		ArrayList<Chunk> nchunks = new ArrayList<>(chunks);
		nchunks.add(chunk);
		return new Heap(nchunks);
	}

	/**
	 * Return a heap identical to this heap except that a given chunk is replaced
	 * by another, in the same position.
	 *
	 * @param before
	 * @param after
	 * @return
	 */
	public Heap replace(Chunk before, Chunk after) {
		int index = chunks.indexOf(before);
		if (index < 0) {
			throw new IllegalArgumentException("chunk not in heap: " + before);
		}
		ArrayList<Chunk> nchunks = new ArrayList<>(chunks);
		nchunks.set(index, after);
		return new Heap(nchunks);
	}

	/**
	 * Get all chunks of a given class, in heap order.
	 *
	 * @param kind
	 * @param <T>
	 * @return
	 */
	public <T extends Chunk> List<T> filter(Class<T> kind) {
		ArrayList<T> result = new ArrayList<>();
		for (Chunk c : chunks) {
			if (kind.isInstance(c)) {
				result.add(kind.cast(c));
			}
		}
		return result;
	}

	@Override
	public Iterator<Chunk> iterator() {
		return chunks.iterator();
	}

	@Override
	public boolean equals(Object o) {
		return o instanceof Heap && ((Heap) o).chunks.equals(chunks);
	}

	@Override
	public int hashCode() {
		return chunks.hashCode();
	}

	@Override
	public String toString() {
		return chunks.toString();
	}
}
