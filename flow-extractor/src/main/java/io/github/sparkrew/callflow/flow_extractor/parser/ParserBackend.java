package io.github.sparkrew.callflow.flow_extractor.parser;

/**
 * The available {@link SourceUnitParser} strategies.
 */
public enum ParserBackend {

    /**
     * Grammar-based parsing with Spoon. Precise, handles nested and anonymous constructs structurally.
     */
    SPOON {
        @Override
        public SourceUnitParser create() {
            return new SpoonSourceUnitParser();
        }
    },

    /**
     * Pattern matching and brace counting over masked source text. No compiler front end needed.
     */
    REGEX {
        @Override
        public SourceUnitParser create() {
            return new RegexSourceUnitParser();
        }
    };

    public abstract SourceUnitParser create();
}
