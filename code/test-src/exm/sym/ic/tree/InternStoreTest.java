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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotSame;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import org.junit.BeforeClass;
import org.junit.Test;

import exm.sym.common.Logging;
import exm.sym.common.lang.FunctionTag;
import exm.sym.ic.poly.Polynomial;

public class InternStoreTest {

  @BeforeClass
  public static void setupLogging() throws Exception {
    Logging.setupLogging("target/InternStoreTest.sym.log", true);
  }

  @Test
  public void testEqualNodesShareHandle() {
    InternStore store = new InternStore();
    NodeRef a = store.intern(new Node.Var("x"));
    NodeRef b = store.intern(new Node.Var("x"));
    assertSame(a, b);
    assertEquals(1, store.size());

    NodeRef y = store.intern(new Node.Var("y"));
    assertNotSame(a, y);
    assertEquals(2, store.size());
  }

  @Test
  public void testCompositeNodes() {
    InternStore store = new InternStore();
    NodeRef x = store.intern(new Node.Var("x"));
    NodeRef s1 = store.intern(new Node.FuncApp(FunctionTag.SIN, x));
    NodeRef s2 = store.intern(new Node.FuncApp(FunctionTag.SIN, x));
    NodeRef c = store.intern(new Node.FuncApp(FunctionTag.COS, x));
    assertSame(s1, s2);
    assertNotSame(s1, c);

    NodeRef p1 = store.intern(new Node.Poly(Polynomial.fromNode(x)));
    NodeRef p2 = store.intern(new Node.Poly(Polynomial.fromNode(x)));
    assertSame(p1, p2);
    assertNotSame("Variable and polynomial x are distinct nodes", x, p1);

    NodeRef t1 = store.intern(new Node.Tuple(Arrays.asList(x, s1)));
    NodeRef t2 = store.intern(new Node.Tuple(Arrays.asList(x, s2)));
    NodeRef t3 = store.intern(new Node.Tuple(Arrays.asList(s1, x)));
    assertSame(t1, t2);
    assertNotSame("Tuple order matters", t1, t3);
  }

  @Test
  public void testHashCollision() {
    // "Aa" and "BB" have the same String hash code
    Node aa = new Node.Var("Aa");
    Node bb = new Node.Var("BB");
    assertEquals(aa.hashCode(), bb.hashCode());

    InternStore store = new InternStore();
    NodeRef ra = store.intern(aa);
    NodeRef rb = store.intern(bb);
    assertNotSame("Colliding nodes stay distinct", ra, rb);
    assertEquals("Aa", ra.asVar().name());
    assertEquals("BB", rb.asVar().name());
    assertTrue(store.collisionCount() >= 1);

    assertSame(ra, store.intern(new Node.Var("Aa")));
    assertSame(rb, store.intern(new Node.Var("BB")));
    assertEquals(2, store.size());
  }

  @Test
  public void testOrdering() {
    InternStore store = new InternStore();
    NodeRef aa = store.intern(new Node.Var("Aa"));
    NodeRef bb = store.intern(new Node.Var("BB"));
    NodeRef x = store.intern(new Node.Var("x"));
    assertTrue("Equal hashes ordered by creation", aa.compareTo(bb) < 0);
    assertTrue(bb.compareTo(aa) > 0);
    assertEquals(0, x.compareTo(x));
  }

  @Test
  public void testUnreferencedEntriesReclaimed() throws Exception {
    InternStore store = new InternStore();
    NodeRef kept = store.intern(new Node.Var("kept"));
    for (int i = 0; i < 1000; i++) {
      store.intern(new Node.Var("dropped" + i));
    }

    // Collection is not guaranteed on the first request
    for (int attempt = 0; attempt < 50 && store.size() > 1; attempt++) {
      System.gc();
      Thread.sleep(20);
    }
    assertEquals("Only the referenced handle is live", 1, store.size());
    assertSame(kept, store.intern(new Node.Var("kept")));

    NodeRef again = store.intern(new Node.Var("dropped0"));
    assertEquals("dropped0", again.asVar().name());
    assertEquals(2, store.size());
  }

  @Test
  public void testConcurrentIntern() throws Exception {
    final InternStore store = new InternStore();
    ExecutorService pool = Executors.newFixedThreadPool(4);
    try {
      List<Future<NodeRef>> results = new ArrayList<Future<NodeRef>>();
      for (int i = 0; i < 32; i++) {
        results.add(pool.submit(new Callable<NodeRef>() {
          @Override
          public NodeRef call() {
            return store.intern(new Node.Var("shared"));
          }
        }));
      }
      NodeRef first = results.get(0).get();
      for (Future<NodeRef> f: results) {
        assertSame(first, f.get());
      }
    } finally {
      pool.shutdown();
    }
  }
}
