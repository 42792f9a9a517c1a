/// A generative grammar for composing random phrases.
///
/// ## Basic usage
/// - `PhraseGrammar.parse(String)` a grammar, resulting in a syntax tree
/// - `PhraseGrammar.generate(String)` a random phrase for a given identifier
///
/// `PhraseGrammar.quick(String)` does both and ignores any errors.
///
/// ## Input format
/// A grammar contains one or more definitions, each an identifier followed by a `[ ]` group. A group
/// holds one or more branches separated by `|`; one is chosen at random. Groups may nest up to 256 levels deep.
/// ```
/// greeting [ hello there | good [morning | evening] ]
/// ```
/// Whitespace is ignored, definitions may span lines, and `//` starts a comment.
///
/// ## Substitutions
/// `{name}` is replaced by a phrase generated for another definition, `{5-25}` by a random number in that
/// range and `{\n}` by a newline. `{*name}` is exclusive: each top-level branch of `name` is used at
/// most once until `PhraseGrammar.reset()`, and asking for more fails.
/// ```
/// measure     [ dl | tbsp | tsp ]
/// ingredient  [ flour | sugar | salt | yeast ]
/// recipe      [ {1-6} {measure} {*ingredient} {\n} {1-6} {measure} {*ingredient} ]
/// ```
///
/// ## Formatting
/// Words are joined with single spaces. Punctuation `. , : ; ! ?` sticks to the preceding word and
/// parentheses to the enclosed one. `<<` joins its neighbours without a space, `_` produces nothing and
/// `^` uppercases the next character.
/// ```
/// weekday [ [Mon|Tues|Wednes] << day, next week? ]
/// verdict [ I'm not angry, but I'm [very | _] disappointed. ]
/// ```
package io.github.simbo1905.phrase.grammar;
