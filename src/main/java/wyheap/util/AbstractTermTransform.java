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

import java.util.ArrayList;
import java.util.List;

import wyheap.core.Logic.Term;

/**
 * A bottom-up rewriting of terms which preserves the identity of any subterm
 * left unchanged.
 *
 * @author David J. Pearce
 *
 */
public abstract class AbstractTermTransform {

    public Term transform(Term term) {
        List<Term> operands = term.getOperands();
        ArrayList<Term> nOperands = new ArrayList<>(operands.size());
        for (int i = 0; i != operands.size(); ++i) {
            nOperands.add(transform(operands.get(i)));
        }
        return rewrite(term.withOperands(nOperands));
    }

    /**
     * Rewrite a given term whose operands have already been transformed.
     * Returning the term itself indicates no change.
     *
     * @param term
     * @return
     */
    protected abstract Term rewrite(Term term);
}
