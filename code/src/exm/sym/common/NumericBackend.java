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
package exm.sym.common;

import java.util.List;

import exm.sym.common.exceptions.BackendException;
import exm.sym.common.lang.FunctionTag;

/**
 * The generic interface for a numeric backend.  The lowering pass drives
 * a backend with the operations below to build a program that computes
 * one expression.
 *
 * Values and storage handles are opaque to the caller: the pass only
 * passes them back into later calls.
 *
 * @param <V> a computed value, e.g. an expression in the target language
 * @param <S> a handle for a stored temporary
 */
public interface NumericBackend<V, S> {

  /**
   * @return short name for diagnostics
   */
  public String name();

  /**
   * An exact integer constant
   */
  public V literalInt(long i) throws BackendException;

  /**
   * A floating point constant
   */
  public V literalFloat(double x) throws BackendException;

  /**
   * A named input.  Called once per distinct input, in order of first
   * occurrence; each becomes a formal parameter of the program.
   */
  public V input(String name) throws BackendException;

  /**
   * n-ary addition, parts.size() >= 2
   */
  public V sum(List<V> parts) throws BackendException;

  /**
   * n-ary multiplication, parts.size() >= 2
   */
  public V product(List<V> parts) throws BackendException;

  /**
   * base^exponent for a positive exponent too large to expand into a
   * product, exponent >= 2
   */
  public V power(V base, long exponent) throws BackendException;

  /**
   * Bind value to a fresh temporary.  The binding must be emitted before
   * any later reference to it.
   * @param uses number of times the temporary will be loaded
   */
  public S store(V value, int uses) throws BackendException;

  /**
   * Reference a previously stored temporary
   */
  public V load(S storage) throws BackendException;

  /** a / b */
  public V divide(V a, V b) throws BackendException;

  /** 1 / a */
  public V invert(V a) throws BackendException;

  /** Ceiling */
  public V roundUp(V x) throws BackendException;

  /** Floor */
  public V roundDown(V x) throws BackendException;

  /**
   * Heaviside step: 1 if x >= threshold else 0
   */
  public V stepAt(V threshold, V x) throws BackendException;

  /**
   * Apply an elementary function.  Backends may reject tags they
   * cannot express with BackendUnsupportedException.
   */
  public V function(FunctionTag tag, V arg) throws BackendException;
}
