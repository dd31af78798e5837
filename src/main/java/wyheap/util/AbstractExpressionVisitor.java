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

import java.util.ArrayList;
import java.util.List;

/**
 * A generic bottom-up traversal over assertions. Each <code>visitX</code> method
 * visits the children of a node before passing the results to the
 * corresponding <code>constructX</code> method.
 *
 * @param <E>
 */
public abstract class AbstractExpressionVisitor<E> {

    public E visitExpression(Expr expr) {
        if (expr instanceof Expr.Boolean || expr instanceof Expr.Integer || expr instanceof Expr.Null
                || expr instanceof Expr.FullPermission || expr instanceof Expr.NoPermission
                || expr instanceof Expr.WildcardPermission) {
            return constructLiteral(expr);
        } else if (expr instanceof Expr.VariableAccess) {
            return constructVariableAccess((Expr.VariableAccess) expr);
        } else if (expr instanceof Expr.Result) {
            return constructResult((Expr.Result) expr);
        } else if (expr instanceof Expr.FieldAccess) {
            return visitFieldAccess((Expr.FieldAccess) expr);
        } else if (expr instanceof Expr.PredicateAccess) {
            return visitPredicateAccess((Expr.PredicateAccess) expr);
        } else if (expr instanceof Expr.AccessPredicate) {
            return visitAccessPredicate((Expr.AccessPredicate) expr);
        } else if (expr instanceof Expr.MagicWand) {
            return visitMagicWand((Expr.MagicWand) expr);
        } else if (expr instanceof Expr.CurrentPermission) {
            return visitCurrentPermission((Expr.CurrentPermission) expr);
        } else if (expr instanceof Expr.BinaryOperator) {
            return visitBinaryOperator((Expr.BinaryOperator) expr);
        } else if (expr instanceof Expr.UnaryOperator) {
            return visitUnaryOperator((Expr.UnaryOperator) expr);
        } else if (expr instanceof Expr.Conditional) {
            return visitConditional((Expr.Conditional) expr);
        } else if (expr instanceof Expr.Let) {
            return visitLet((Expr.Let) expr);
        } else if (expr instanceof Expr.Quantifier) {
            return visitQuantifier((Expr.Quantifier) expr);
        } else if (expr instanceof Expr.Unfolding) {
            return visitUnfolding((Expr.Unfolding) expr);
        } else if (expr instanceof Expr.Applying) {
            return visitApplying((Expr.Applying) expr);
        } else if (expr instanceof Expr.InhaleExhale) {
            return visitInhaleExhale((Expr.InhaleExhale) expr);
        } else if (expr instanceof Expr.Invoke) {
            return visitInvoke((Expr.Invoke) expr);
        } else {
            throw new IllegalArgumentException("unknown expression encountered (" + expr.getClass().getName() + ")");
        }
    }

    protected List<E> visitExpressions(List<Expr> exprs) {
        List<E> results = new ArrayList<>();
        for (int i = 0; i != exprs.size(); ++i) {
            results.add(visitExpression(exprs.get(i)));
        }
        return results;
    }

    protected E visitFieldAccess(Expr.FieldAccess expr) {
        E receiver = visitExpression(expr.getReceiver());
        return constructFieldAccess(expr, receiver);
    }

    protected E visitPredicateAccess(Expr.PredicateAccess expr) {
        List<E> arguments = visitExpressions(expr.getArguments());
        return constructPredicateAccess(expr, arguments);
    }

    protected E visitAccessPredicate(Expr.AccessPredicate expr) {
        E location = visitExpression(expr.getLocation());
        E permission = visitExpression(expr.getPermission());
        return constructAccessPredicate(expr, location, permission);
    }

    protected E visitMagicWand(Expr.MagicWand expr) {
        E lhs = visitExpression(expr.getLeftHandSide());
        E rhs = visitExpression(expr.getRightHandSide());
        return constructMagicWand(expr, lhs, rhs);
    }

    protected E visitCurrentPermission(Expr.CurrentPermission expr) {
        E location = visitExpression(expr.getLocation());
        return constructCurrentPermission(expr, location);
    }

    protected E visitBinaryOperator(Expr.BinaryOperator expr) {
        E lhs = visitExpression(expr.getLeftHandSide());
        E rhs = visitExpression(expr.getRightHandSide());
        return constructBinaryOperator(expr, lhs, rhs);
    }

    protected E visitUnaryOperator(Expr.UnaryOperator expr) {
        E operand = visitExpression(expr.getOperand());
        return constructUnaryOperator(expr, operand);
    }

    protected E visitConditional(Expr.Conditional expr) {
        E condition = visitExpression(expr.getCondition());
        E trueBranch = visitExpression(expr.getTrueBranch());
        E falseBranch = visitExpression(expr.getFalseBranch());
        return constructConditional(expr, condition, trueBranch, falseBranch);
    }

    protected E visitLet(Expr.Let expr) {
        E initialiser = visitExpression(expr.getInitialiser());
        E body = visitExpression(expr.getBody());
        return constructLet(expr, initialiser, body);
    }

    protected E visitQuantifier(Expr.Quantifier expr) {
        E body = visitExpression(expr.getBody());
        return constructQuantifier(expr, body);
    }

    protected E visitUnfolding(Expr.Unfolding expr) {
        E predicate = visitExpression(expr.getPredicate());
        E body = visitExpression(expr.getBody());
        return constructUnfolding(expr, predicate, body);
    }

    protected E visitApplying(Expr.Applying expr) {
        E wand = visitExpression(expr.getWand());
        E body = visitExpression(expr.getBody());
        return constructApplying(expr, wand, body);
    }

    protected E visitInhaleExhale(Expr.InhaleExhale expr) {
        E inhale = visitExpression(expr.getInhale());
        E exhale = visitExpression(expr.getExhale());
        return constructInhaleExhale(expr, inhale, exhale);
    }

    protected E visitInvoke(Expr.Invoke expr) {
        List<E> arguments = visitExpressions(expr.getArguments());
        return constructInvoke(expr, arguments);
    }

    protected abstract E constructLiteral(Expr expr);

    protected abstract E constructVariableAccess(Expr.VariableAccess expr);

    protected abstract E constructResult(Expr.Result expr);

    protected abstract E constructFieldAccess(Expr.FieldAccess expr, E receiver);

    protected abstract E constructPredicateAccess(Expr.PredicateAccess expr, List<E> arguments);

    protected abstract E constructAccessPredicate(Expr.AccessPredicate expr, E location, E permission);

    protected abstract E constructMagicWand(Expr.MagicWand expr, E lhs, E rhs);

    protected abstract E constructCurrentPermission(Expr.CurrentPermission expr, E location);

    protected abstract E constructBinaryOperator(Expr.BinaryOperator expr, E lhs, E rhs);

    protected abstract E constructUnaryOperator(Expr.UnaryOperator expr, E operand);

    protected abstract E constructConditional(Expr.Conditional expr, E condition, E trueBranch, E falseBranch);

    protected abstract E constructLet(Expr.Let expr, E initialiser, E body);

    protected abstract E constructQuantifier(Expr.Quantifier expr, E body);

    protected abstract E constructUnfolding(Expr.Unfolding expr, E predicate, E body);

    protected abstract E constructApplying(Expr.Applying expr, E wand, E body);

    protected abstract E constructInhaleExhale(Expr.InhaleExhale expr, E inhale, E exhale);

    protected abstract E constructInvoke(Expr.Invoke expr, List<E> arguments);
}
