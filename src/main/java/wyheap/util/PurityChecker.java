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

import wyheap.core.Program.Expr;

/**
 * Determines whether an assertion is <i>pure</i>, meaning it holds no
 * resources and, hence, can be evaluated directly to a boolean term. For
 * example, <code>x.f > 0 ==> y != null</code> is pure whilst
 * <code>b ==> acc(x.f, write)</code> is not. Function applications and
 * unfolding expressions are pure, since any resources they mention are
 * required rather than held.
 *
 * @author David J. Pearce
 *
 */
public class PurityChecker extends AbstractExpressionFold<Boolean> {
    private static final PurityChecker INSTANCE = new PurityChecker();

    public static boolean isPure(Expr expr) {
        return INSTANCE.visitExpression(expr);
    }

    @Override
    protected Boolean constructAccessPredicate(Expr.AccessPredicate expr, Boolean location, Boolean permission) {
        return false;
    }

    @Override
    protected Boolean constructMagicWand(Expr.MagicWand expr, Boolean lhs, Boolean rhs) {
        return false;
    }

    @Override
    protected Boolean constructUnfolding(Expr.Unfolding expr, Boolean predicate, Boolean body) {
        return body;
    }

    @Override
    protected Boolean constructApplying(Expr.Applying expr, Boolean wand, Boolean body) {
        return body;
    }

    @Override
    protected Boolean constructCurrentPermission(Expr.CurrentPermission expr, Boolean location) {
        return true;
    }

    @Override
    protected Boolean join(Boolean lhs, Boolean rhs) {
        return lhs && rhs;
    }

    @Override
    protected Boolean BOTTOM() {
        return true;
    }
}
