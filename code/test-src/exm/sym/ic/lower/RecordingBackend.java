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
package exm.sym.ic.lower;

import java.util.ArrayList;
import java.util.List;

import org.apache.commons.lang3.StringUtils;

import exm.sym.common.NumericBackend;
import exm.sym.common.lang.FunctionTag;

/**
 * Backend that renders every operation as fully parenthesized text and
 * records the stores it is asked to make
 */
class RecordingBackend implements NumericBackend<String, String> {

  final List<String> storeLog = new ArrayList<String>();
  final List<Integer> storeUses = new ArrayList<Integer>();

  @Override
  public String name() {
    return "recording";
  }

  @Override
  public String literalInt(long i) {
    return Long.toString(i);
  }

  @Override
  public String literalFloat(double x) {
    return Double.toString(x);
  }

  @Override
  public String input(String name) {
    return name;
  }

  @Override
  public String sum(List<String> parts) {
    assert(parts.size() >= 2);
    return "(" + StringUtils.join(parts, " + ") + ")";
  }

  @Override
  public String product(List<String> parts) {
    assert(parts.size() >= 2);
    return "(" + StringUtils.join(parts, " * ") + ")";
  }

  @Override
  public String power(String base, long exponent) {
    return "(" + base + " ^ " + exponent + ")";
  }

  @Override
  public String store(String value, int uses) {
    String name = "t" + storeLog.size();
    storeLog.add(name + " = " + value);
    storeUses.add(uses);
    return name;
  }

  @Override
  public String load(String storage) {
    return storage;
  }

  @Override
  public String divide(String a, String b) {
    return "(" + a + " / " + b + ")";
  }

  @Override
  public String invert(String a) {
    return "(1 / " + a + ")";
  }

  @Override
  public String roundUp(String x) {
    return "ceil(" + x + ")";
  }

  @Override
  public String roundDown(String x) {
    return "floor(" + x + ")";
  }

  @Override
  public String stepAt(String threshold, String x) {
    return "step(" + threshold + ", " + x + ")";
  }

  @Override
  public String function(FunctionTag tag, String arg) {
    return tag.displayName() + "(" + arg + ")";
  }
}
