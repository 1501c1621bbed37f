package software.amazon.nfa.input;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import static software.amazon.nfa.input.ConditionType.CLASS;

/**
 * A Condition for a bracketed character class such as [a-z_\d] or [^"]. The class accepts a code point if any member
 * accepts it, or, for a negated class, if no member does.
 */
public class CharacterClassCondition extends Condition {

    private final boolean negated;
    private final List<Condition> members;

    CharacterClassCondition(final boolean negated, final List<Condition> members) {
        if (members.isEmpty()) {
            throw new IllegalArgumentException("Character class must have at least one member");
        }
        for (Condition member : members) {
            if (member.getType() == CLASS || member.isEpsilon()) {
                throw new IllegalArgumentException("Character class cannot contain " + member);
            }
        }
        this.negated = negated;
        this.members = Collections.unmodifiableList(new ArrayList<>(members));
    }

    public static CharacterClassCondition cast(Condition condition) {
        return (CharacterClassCondition) condition;
    }

    public boolean isNegated() {
        return negated;
    }

    public List<Condition> getMembers() {
        return members;
    }

    @Override
    public ConditionType getType() {
        return CLASS;
    }

    @Override
    public boolean matches(final int codePoint) {
        for (Condition member : members) {
            if (member.matches(codePoint)) {
                return !negated;
            }
        }
        return negated;
    }

    @Override
    public boolean equals(Object o) {
        if (o == null || !(o.getClass() == getClass())) {
            return false;
        }
        CharacterClassCondition other = (CharacterClassCondition) o;
        return other.negated == negated && other.members.equals(members);
    }

    @Override
    public int hashCode() {
        return Objects.hash(negated, members);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("[");
        if (negated) {
            sb.append('^');
        }
        for (Condition member : members) {
            sb.append(member.toClassMemberString());
        }
        return sb.append(']').toString();
    }
}
