package oscilla.fieldc.compiler.cardinality;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import oscilla.fieldc.compiler.graph.ConstraintOrigin;
import oscilla.fieldc.compiler.types.InferenceCardinality;
import oscilla.fieldc.compiler.types.InstanceTerm;

/**
 * Everything known about one equality group.
 */
public class GroupFacts {

    private boolean forcedOne;
    private final List<InstanceTerm> forcedManyTerms;
    private final List<ConstraintOrigin> clampOneOrigins;
    private final List<ConstraintOrigin> forceManyOrigins;
    private Optional<InferenceCardinality> finalCard;
    private boolean tainted;

    public GroupFacts() {
        this.forcedOne = false;
        this.forcedManyTerms = new ArrayList<>();
        this.clampOneOrigins = new ArrayList<>();
        this.forceManyOrigins = new ArrayList<>();
        this.finalCard = Optional.empty();
        this.tainted = false;
    }

    void forceOne(ConstraintOrigin origin) {
        this.forcedOne = true;
        this.clampOneOrigins.add(origin);
    }

    void forceMany(InstanceTerm term, ConstraintOrigin origin) {
        this.forcedManyTerms.add(term);
        this.forceManyOrigins.add(origin);
    }

    void absorb(GroupFacts other) {
        if(other == this) {
            return;
        }
        this.forcedOne |= other.forcedOne;
        this.forcedManyTerms.addAll(other.forcedManyTerms);
        this.clampOneOrigins.addAll(other.clampOneOrigins);
        this.forceManyOrigins.addAll(other.forceManyOrigins);
        this.tainted |= other.tainted;
        if(this.finalCard.isEmpty()) {
            this.finalCard = other.finalCard;
        }
    }

    void decide(InferenceCardinality card) {
        if(this.finalCard.isPresent()) {
            throw new IllegalStateException(
                "Group was already decided as " + this.finalCard.get()
                    + ", can't change it to " + card + "!"
            );
        }
        this.finalCard = Optional.of(card);
    }

    void taint() {
        this.tainted = true;
    }

    public boolean isForcedOne() {
        return this.forcedOne;
    }

    public List<InstanceTerm> forcedManyTerms() {
        return List.copyOf(this.forcedManyTerms);
    }

    public List<ConstraintOrigin> clampOneOrigins() {
        return List.copyOf(this.clampOneOrigins);
    }

    public List<ConstraintOrigin> forceManyOrigins() {
        return List.copyOf(this.forceManyOrigins);
    }

    public Optional<InferenceCardinality> finalCard() {
        return this.finalCard;
    }

    public boolean isUndecided() {
        return this.finalCard.isEmpty();
    }

    public boolean isDecided(InferenceCardinality.Kind kind) {
        return this.finalCard.isPresent()
            && this.finalCard.get().kind() == kind;
    }

    public boolean isTainted() {
        return this.tainted;
    }

    @Override
    public String toString() {
        return "GroupFacts[forcedOne=" + this.forcedOne
            + ", forcedMany=" + this.forcedManyTerms
            + ", final=" + this.finalCard.map(Object::toString).orElse("?")
            + (this.tainted? ", tainted" : "") + "]";
    }

}
