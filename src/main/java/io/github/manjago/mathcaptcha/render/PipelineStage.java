package io.github.manjago.mathcaptcha.render;

/**
 * Steps that turn a LaTeX document into a PNG, in execution order.
 */
public enum PipelineStage {

    /** Write {@code <key>.tex} to the work directory. */
    WRITE_SOURCE("write source"),

    /** Run LaTeX, producing {@code <key>.dvi}. */
    TYPESET("typeset"),

    /** Run dvipng, producing {@code <key>.png}. */
    RASTERIZE("rasterize");

    private final String description;

    PipelineStage(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}
