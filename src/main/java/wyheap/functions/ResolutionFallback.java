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
package wyheap.functions;

import java.util.function.BiFunction;
import java.util.function.BiPredicate;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import wyheap.core.Logic.Sort;
import wyheap.core.Logic.Term;
import wyheap.core.Program;
import wyheap.verifier.Decider;
import wyheap.verifier.Reporter;

/**
 * Handles subexpressions whose translation depends on a term which should have
 * been recorded during verification of the enclosing function, but was not.
 * A fresh placeholder is always substituted, so translation can continue. A
 * warning is issued for the first such subexpression of a translation, unless
 * the function has already failed verification. Whether or not the
 * translation as a whole fails is determined by a given policy.
 *
 * @author David J. Pearce
 *
 */
public class ResolutionFallback {
	private static final Logger LOGGER = LoggerFactory.getLogger(ResolutionFallback.class);

	private final Decider decider;
	private final BiPredicate<Program.Position, FunctionData> fatal;
	private final BiFunction<Program.Position, FunctionData, String> message;
	private final Reporter reporter;

	public ResolutionFallback(Decider decider, BiPredicate<Program.Position, FunctionData> fatal,
			BiFunction<Program.Position, FunctionData, String> message, Reporter reporter) {
		this.decider = decider;
		this.fatal = fatal;
		this.message = message;
		this.reporter = reporter;
	}

	/**
	 * Resolve an item for which no term was recorded.
	 *
	 * @param context The context of the translation encountering the item.
	 * @param item    The item which could not be resolved.
	 * @param sort    The sort of the required term.
	 * @return A placeholder term of the given sort.
	 */
	public Term resolve(TranslationContext context, Program.Item item, Sort sort) {
		FunctionData data = context.getData();
		TranslationContext.Outcome outcome = context.getOutcome();
		Program.Position position = item.getPosition();
		if (!outcome.hasWarned() && data.getVerificationFailures().isEmpty()) {
			String msg = message.apply(position, data);
			reporter.warning(msg);
			LOGGER.warn(msg);
			outcome.markWarned();
		}
		if (fatal.test(position, data)) {
			outcome.markFailed();
		}
		return decider.fresh("$unresolved", sort);
	}
}
