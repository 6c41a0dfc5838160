/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License
 */
package exm.sym.ic.tree;

import java.lang.ref.Reference;
import java.lang.ref.ReferenceQueue;
import java.lang.ref.WeakReference;
import java.util.List;

import org.apache.log4j.Logger;

import com.google.common.collect.ArrayListMultimap;
import com.google.common.collect.ListMultimap;

import exm.sym.common.Logging;

/**
 * Hash-consing store: gives every distinct live node value exactly one
 * {@link NodeRef}.
 *
 * Entries are bucketed by structural hash.  A bucket may hold several
 * entries if unequal nodes collide, and lookups always check full
 * structural equality before reusing an entry.
 *
 * The store only holds weak references.  Once nothing else refers to a
 * handle, the garbage collector may reclaim it and its bucket entry is
 * dropped the next time the store is used.
 *
 * All operations are synchronized so that concurrent callers can never
 * create two handles for the same value.
 */
public class InternStore {

  private static final Logger logger = Logging.getSymLogger();

  private final ListMultimap<Integer, WeakEntry> buckets =
                                            ArrayListMultimap.create();

  private final ReferenceQueue<NodeRef> reclaimed =
                                            new ReferenceQueue<NodeRef>();

  private long nextSerial = 0;

  /** Number of times a lookup met a different node with equal hash */
  private long collisions = 0;

  /**
   * Return the canonical handle for the node, registering it if no equal
   * node is currently interned.
   */
  public synchronized NodeRef intern(Node node) {
    purge();
    Integer hash = node.hashCode();
    List<WeakEntry> chain = buckets.get(hash);
    for (WeakEntry entry: chain) {
      NodeRef existing = entry.get();
      if (existing == null) {
        // Collected but not yet dequeued
        continue;
      }
      if (existing.node().equals(node)) {
        return existing;
      }
      collisions++;
      if (logger.isDebugEnabled()) {
        logger.debug("Hash collision in intern store: " + node +
                     " vs. " + existing.node() + " (hash " + hash + ")");
      }
    }

    NodeRef ref = new NodeRef(node, nextSerial++);
    chain.add(new WeakEntry(ref, hash, reclaimed));
    if (logger.isTraceEnabled()) {
      logger.trace("Interned #" + ref.serial() + ": " + node);
    }
    return ref;
  }

  /**
   * @return number of live entries
   */
  public synchronized int size() {
    purge();
    int live = 0;
    for (WeakEntry entry: buckets.values()) {
      if (entry.get() != null) {
        live++;
      }
    }
    return live;
  }

  public synchronized long collisionCount() {
    return collisions;
  }

  /**
   * Drop bucket entries whose handles have been collected
   */
  private void purge() {
    Reference<? extends NodeRef> ref;
    while ((ref = reclaimed.poll()) != null) {
      WeakEntry entry = (WeakEntry)ref;
      buckets.remove(entry.hash, entry);
    }
  }

  private static class WeakEntry extends WeakReference<NodeRef> {
    private final Integer hash;

    WeakEntry(NodeRef ref, Integer hash, ReferenceQueue<NodeRef> queue) {
      super(ref, queue);
      this.hash = hash;
    }
  }
}
