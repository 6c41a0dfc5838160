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
package exm.sym.evalbackend;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import exm.sym.common.NumericBackend;
import exm.sym.common.exceptions.BackendException;
import exm.sym.common.exceptions.UnboundInputException;
import exm.sym.common.exceptions.UserException;
import exm.sym.common.lang.FunctionTag;
import exm.sym.ic.lower.DagLowering;
import exm.sym.ic.lower.LoweredProgram;
import exm.sym.ic.tree.NodeRef;

/**
 * Numeric backend that evaluates directly in double precision.  Stored
 * temporaries live in numbered slots.
 */
public class DoubleEvaluator implements NumericBackend<Double, Integer> {

  public static final String NAME = "double";

  private final Map<String, Double> bindings;
  private final List<Double> slots = new ArrayList<Double>();

  public DoubleEvaluator(Map<String, Double> bindings) {
    this.bindings = new HashMap<String, Double>(bindings);
  }

  /**
   * Evaluate a non-tuple expression with the given input values
   */
  public static double evaluate(NodeRef root, Map<String, Double> bindings)
      throws UserException {
    LoweredProgram<Double, Integer> prog =
        DagLowering.lower(new DoubleEvaluator(bindings), root);
    return prog.result();
  }

  /**
   * Evaluate an expression, one value per top-level tuple element
   */
  public static List<Double> evaluateAll(NodeRef root,
        Map<String, Double> bindings) throws UserException {
    LoweredProgram<Double, Integer> prog =
        DagLowering.lower(new DoubleEvaluator(bindings), root);
    return prog.results();
  }

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public Double literalInt(long i) {
    return (double)i;
  }

  @Override
  public Double literalFloat(double x) {
    return x;
  }

  @Override
  public Double input(String name) throws UnboundInputException {
    Double val = bindings.get(name);
    if (val == null) {
      throw new UnboundInputException(name);
    }
    return val;
  }

  @Override
  public Double sum(List<Double> parts) {
    double total = 0.0;
    for (Double x: parts) {
      total += x;
    }
    return total;
  }

  @Override
  public Double product(List<Double> parts) {
    double total = 1.0;
    for (Double x: parts) {
      total *= x;
    }
    return total;
  }

  @Override
  public Double power(Double base, long exponent) {
    return Math.pow(base, exponent);
  }

  @Override
  public Integer store(Double value, int uses) {
    slots.add(value);
    return slots.size() - 1;
  }

  @Override
  public Double load(Integer storage) {
    return slots.get(storage);
  }

  @Override
  public Double divide(Double a, Double b) {
    return a / b;
  }

  @Override
  public Double invert(Double a) {
    return 1.0 / a;
  }

  @Override
  public Double roundUp(Double x) {
    return Math.ceil(x);
  }

  @Override
  public Double roundDown(Double x) {
    return Math.floor(x);
  }

  @Override
  public Double stepAt(Double threshold, Double x) {
    return x >= threshold ? 1.0 : 0.0;
  }

  @Override
  public Double function(FunctionTag tag, Double arg)
      throws BackendException {
    switch (tag) {
      case SIN:
        return Math.sin(arg);
      case COS:
        return Math.cos(arg);
      case EXP:
        return Math.exp(arg);
      case LOG:
        return Math.log(arg);
      case FLOOR:
        return roundDown(arg);
      case CEIL:
        return roundUp(arg);
      case STEP:
        return stepAt(0.0, arg);
      default:
        throw new BackendException("Unknown function tag " + tag);
    }
  }
}
