package org.kwindex.runtime.usage;

import java.util.Optional;

/**
 * Call-scoped state the usage formatter reads and writes: the current error result, the
 * alternate-usage flag, and the active ensemble rewrite.
 * <p>
 * With the alternate flag set, {@link WrongArgsFormatter#wrongNumArgs} appends
 * {@code or "..."} to the existing result, so commands with several valid call shapes can
 * list them all in one message.
 */
public class UsageContext {

    private String result = "";
    private boolean alternateUsage;
    private EnsembleRewrite ensembleRewrite;

    public String getResult() {
        return result;
    }

    public void setResult(String result) {
        this.result = result == null ? "" : result;
    }

    public boolean isAlternateUsage() {
        return alternateUsage;
    }

    public void setAlternateUsage(boolean alternateUsage) {
        this.alternateUsage = alternateUsage;
    }

    public Optional<EnsembleRewrite> getEnsembleRewrite() {
        return Optional.ofNullable(ensembleRewrite);
    }

    /**
     * Sets the rewrite of the command currently being executed.
     *
     * @param ensembleRewrite The rewrite, or {@code null} when the command was invoked directly.
     */
    public void setEnsembleRewrite(EnsembleRewrite ensembleRewrite) {
        this.ensembleRewrite = ensembleRewrite;
    }
}
