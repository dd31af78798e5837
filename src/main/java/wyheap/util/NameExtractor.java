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
package wyheap.util;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import wyheap.core.Program.Expr;

/**
 * Collects the names of the functions invoked, or predicates mentioned, within
 * a given expression, in order of first occurrence.
 *
 * @author David J. Pearce
 *
 */
public abstract class NameExtractor extends AbstractExpressionFold<Set<String>> {

    /**
     * Extracts the names of all functions invoked in an expression.
     */
    public static final NameExtractor FUNCTIONS = new NameExtractor() {
        @Override
        protected Set<String> constructInvoke(Expr.Invoke expr, List<Set<String>> arguments) {
            return join(Collections.singleton(expr.getName()), join(arguments));
        }
    };

    /**
     * Extracts the names of all predicates mentioned in an expression, whether
     * through an access predicate or an unfolding.
     */
    public static final NameExtractor PREDICATES = new NameExtractor() {
        @Override
        protected Set<String> constructPredicateAccess(Expr.PredicateAccess expr, List<Set<String>> arguments) {
            return join(Collections.singleton(expr.getName()), join(arguments));
        }
    };

    public Set<String> extract(Expr expr) {
        return visitExpression(expr);
    }

    public Set<String> extract(List<Expr> exprs) {
        return join(visitExpressions(exprs));
    }

    @Override
    protected Set<String> join(Set<String> lhs, Set<String> rhs) {
        if (lhs.isEmpty()) {
            return rhs;
        } else if (rhs.isEmpty()) {
            return lhs;
        }
        LinkedHashSet<String> result = new LinkedHashSet<>(lhs);
        result.addAll(rhs);
        return result;
    }

    @Override
    protected Set<String> BOTTOM() {
        return Collections.emptySet();
    }
}
