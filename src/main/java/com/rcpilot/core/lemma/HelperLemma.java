package com.rcpilot.core.lemma;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * Auxiliary Coq fact handed to the verifier. A blank proof body means the
 * lemma is admitted rather than proved.
 */
public final class HelperLemma {

    private final String       name;
    private final String       statement;
    private final String       proofBody;
    private final List<String> dependencies;

    @JsonCreator
    public HelperLemma(@JsonProperty("name") String name,
                       @JsonProperty("statement") String statement,
                       @JsonProperty("proofBody") String proofBody,
                       @JsonProperty("dependencies") List<String> dependencies) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Lemma name must not be blank");
        }
        if (statement == null || statement.isBlank()) {
            throw new IllegalArgumentException("Lemma statement must not be blank: " + name);
        }
        this.name         = name.trim();
        this.statement    = statement.trim();
        this.proofBody    = proofBody != null ? proofBody.strip() : "";
        this.dependencies = dependencies != null ? List.copyOf(dependencies) : List.of();
    }

    public String       getName()         { return name; }
    public String       getStatement()    { return statement; }
    public String       getProofBody()    { return proofBody; }
    public List<String> getDependencies() { return dependencies; }

    @JsonIgnore
    public boolean isAdmitted() {
        return proofBody.isBlank();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof HelperLemma)) return false;
        HelperLemma that = (HelperLemma) o;
        return name.equals(that.name) && statement.equals(that.statement)
                && proofBody.equals(that.proofBody) && dependencies.equals(that.dependencies);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, statement, proofBody, dependencies);
    }

    @Override
    public String toString() {
        return "HelperLemma{" + name + (isAdmitted() ? ", admitted" : "") + "}";
    }
}
