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

import java.util.List;

/**
 * A visitor which combines the results from child nodes using a binary
 * <code>join</code> and yields <code>BOTTOM()</code> at the leaves.
 *
 * @param <E>
 */
public abstract class AbstractExpressionFold<E> extends AbstractExpressionVisitor<E> {

    @Override
    protected E constructLiteral(Expr expr) {
        return BOTTOM();
    }

    @Override
    protected E constructVariableAccess(Expr.VariableAccess expr) {
        return BOTTOM();
    }

    @Override
    protected E constructResult(Expr.Result expr) {
        return BOTTOM();
    }

    @Override
    protected E constructFieldAccess(Expr.FieldAccess expr, E receiver) {
        return receiver;
    }

    @Override
    protected E constructPredicateAccess(Expr.PredicateAccess expr, List<E> arguments) {
        return join(arguments);
    }

    @Override
    protected E constructAccessPredicate(Expr.AccessPredicate expr, E location, E permission) {
        return join(location, permission);
    }

    @Override
    protected E constructMagicWand(Expr.MagicWand expr, E lhs, E rhs) {
        return join(lhs, rhs);
    }

    @Override
    protected E constructCurrentPermission(Expr.CurrentPermission expr, E location) {
        return location;
    }

    @Override
    protected E constructBinaryOperator(Expr.BinaryOperator expr, E lhs, E rhs) {
        return join(lhs, rhs);
    }

    @Override
    protected E constructUnaryOperator(Expr.UnaryOperator expr, E operand) {
        return operand;
    }

    @Override
    protected E constructConditional(Expr.Conditional expr, E condition, E trueBranch, E falseBranch) {
        return join(condition, join(trueBranch, falseBranch));
    }

    @Override
    protected E constructLet(Expr.Let expr, E initialiser, E body) {
        return join(initialiser, body);
    }

    @Override
    protected E constructQuantifier(Expr.Quantifier expr, E body) {
        return body;
    }

    @Override
    protected E constructUnfolding(Expr.Unfolding expr, E predicate, E body) {
        return join(predicate, body);
    }

    @Override
    protected E constructApplying(Expr.Applying expr, E wand, E body) {
        return join(wand, body);
    }

    @Override
    protected E constructInhaleExhale(Expr.InhaleExhale expr, E inhale, E exhale) {
        return join(inhale, exhale);
    }

    @Override
    protected E constructInvoke(Expr.Invoke expr, List<E> arguments) {
        return join(arguments);
    }

    protected E join(List<E> operands) {
        E result = BOTTOM();
        for (int i = 0; i != operands.size(); ++i) {
            result = join(result, operands.get(i));
        }
        return result;
    }

    protected abstract E join(E lhs, E rhs);

    protected abstract E BOTTOM();
}
