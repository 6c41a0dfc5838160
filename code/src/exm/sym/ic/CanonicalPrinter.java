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
package exm.sym.ic;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import exm.sym.common.Settings;
import exm.sym.common.exceptions.ExponentOverflowException;
import exm.sym.common.exceptions.SymRuntimeError;
import exm.sym.common.lang.Rational;
import exm.sym.common.util.StringUtil;
import exm.sym.ic.poly.Monomial;
import exm.sym.ic.poly.Polynomial;
import exm.sym.ic.poly.Power;
import exm.sym.ic.tree.Node;
import exm.sym.ic.tree.Node.FuncApp;
import exm.sym.ic.tree.Node.Tuple;
import exm.sym.ic.tree.NodeRef;

/**
 * Renders nodes and polynomials as text, tokens separated by single
 * spaces, e.g. {@code - 1 + 2 x³ / 3}.
 *
 * Output is for people and tests only; nothing may depend on it for
 * semantic decisions.  Equality of expressions is equality of handles.
 */
public class CanonicalPrinter {

  public static String print(NodeRef node) {
    return print(node.node());
  }

  public static String print(Node node) {
    return StringUtil.concat(nodeTokens(node));
  }

  /**
   * Print polynomial as a plain sum of terms
   */
  public static String printSum(Polynomial p) {
    List<String> tokens = new ArrayList<String>();
    sumTokens(p, tokens);
    return StringUtil.concat(tokens);
  }

  private static List<String> nodeTokens(Node node) {
    List<String> tokens = new ArrayList<String>();
    switch (node.kind) {
      case VAR:
        tokens.add(((Node.Var)node).name());
        break;
      case FUNC_APP: {
        FuncApp app = (FuncApp)node;
        tokens.add(app.tag().displayName() + "(" + print(app.arg()) + ")");
        break;
      }
      case POLY: {
        Polynomial p = ((Node.Poly)node).poly();
        Polynomial[] factors = null;
        if (Settings.getBooleanUnchecked(Settings.PRINT_FACTORIZE)) {
          factors = factorize(p);
        }
        if (factors != null) {
          tokens.add(wrap(factors[0]));
          tokens.add(wrap(factors[1]));
        } else {
          sumTokens(p, tokens);
        }
        break;
      }
      case TUPLE: {
        List<String> parts = new ArrayList<String>();
        for (NodeRef elem: ((Tuple)node).elements()) {
          parts.add(print(elem));
        }
        tokens.add("(" + StringUtil.concat(", ", parts) + ")");
        break;
      }
      default:
        throw new SymRuntimeError("Unknown node kind " + node.kind);
    }
    return tokens;
  }

  private static void sumTokens(Polynomial p, List<String> tokens) {
    int n = 0;
    for (Map.Entry<Monomial, Rational> term: p.sortedTerms()) {
      Monomial m = term.getKey();
      BigInteger num = term.getValue().numerator();
      BigInteger den = term.getValue().denominator();

      if (num.signum() < 0) {
        tokens.add("-");
      } else if (n != 0) {
        tokens.add("+");
      }
      if (!num.abs().equals(BigInteger.ONE) || m.isConstant()) {
        tokens.add(num.abs().toString());
      }

      for (Power pow: m.powers()) {
        String base = printBase(pow.base());
        if (pow.exponent() == 1) {
          tokens.add(base);
        } else {
          tokens.add(base + StringUtil.superscript(pow.exponent()));
        }
      }

      if (!den.equals(BigInteger.ONE)) {
        tokens.add("/");
        tokens.add(den.toString());
      }
      n++;
    }
    if (tokens.isEmpty()) {
      tokens.add("0");
    }
  }

  /**
   * Bases that print as several tokens are parenthesized
   */
  private static String printBase(NodeRef base) {
    String s = print(base);
    if (base.isPoly() && s.indexOf(' ') >= 0) {
      return "(" + s + ")";
    }
    return s;
  }

  private static String wrap(Polynomial p) {
    String s = printSum(p);
    if (p.size() > 1) {
      return "(" + s + ")";
    }
    return s;
  }

  /**
   * Best-effort split of a sum into a common factor times the remaining
   * sum, e.g. 2 x + 4 x y becomes 2 x (1 + 2 y).
   * Only the common content of the coefficients and bases with positive
   * exponents shared by every term are pulled out.
   * @return {factor, rest} or null if there is no nontrivial factor
   */
  static Polynomial[] factorize(Polynomial p) {
    if (p.size() < 2) {
      return null;
    }
    BigInteger numGcd = BigInteger.ZERO;
    BigInteger denLcm = BigInteger.ONE;
    Map<NodeRef, Long> common = null;
    for (Map.Entry<Monomial, Rational> term: p.sortedTerms()) {
      Rational c = term.getValue();
      numGcd = numGcd.gcd(c.numerator());
      BigInteger den = c.denominator();
      denLcm = denLcm.multiply(den).divide(denLcm.gcd(den));

      Map<NodeRef, Long> exponents = new LinkedHashMap<NodeRef, Long>();
      for (Power pow: term.getKey().powers()) {
        if (pow.exponent() > 0) {
          exponents.put(pow.base(), pow.exponent());
        }
      }
      if (common == null) {
        common = exponents;
      } else {
        Iterator<Map.Entry<NodeRef, Long>> it = common.entrySet().iterator();
        while (it.hasNext()) {
          Map.Entry<NodeRef, Long> e = it.next();
          Long other = exponents.get(e.getKey());
          if (other == null) {
            it.remove();
          } else {
            e.setValue(Math.min(e.getValue(), other));
          }
        }
      }
    }

    Rational content = Rational.of(numGcd, denLcm);
    List<Power> powers = new ArrayList<Power>();
    for (Map.Entry<NodeRef, Long> e: common.entrySet()) {
      powers.add(new Power(e.getKey(), e.getValue()));
    }
    try {
      Monomial commonMonomial = Monomial.of(powers);
      if (content.isOne() && commonMonomial.isConstant()) {
        return null;
      }

      Polynomial factor = Polynomial.monomial(commonMonomial, content);
      Monomial inverse = commonMonomial.pow(-1);
      Rational invContent = content.reciprocal();
      Polynomial rest = Polynomial.zero();
      for (Map.Entry<Monomial, Rational> term: p.terms()) {
        rest = rest.add(Polynomial.monomial(term.getKey().multiply(inverse),
                                     term.getValue().multiply(invContent)));
      }
      return new Polynomial[] {factor, rest};
    } catch (ExponentOverflowException e) {
      // Common exponents are positive and no larger than any term's
      throw new SymRuntimeError("Exponent overflow while factoring " + p, e);
    }
  }
}
