package com.pharbit.ledger.core.transition;

import com.pharbit.ledger.core.model.GovernanceState;
import com.pharbit.ledger.core.model.Identity;
import com.pharbit.ledger.core.model.Role;
import com.pharbit.ledger.core.spi.StateChange;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 레저 초기 상태 (역할 부여, Owner 집합, 정족수).
 *
 * <p>Genesis는 엔진 생성 시 이벤트 없이 한 번 적용됩니다. 같은 Genesis와 같은 이벤트 순서로
 * 새 엔진을 만들면 같은 상태가 재구성됩니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * LedgerGenesis genesis = LedgerGenesis.builder()
 *     .grant(admin, Role.ADMIN, Role.REGISTRAR)
 *     .owner(o1).owner(o2).owner(o3)
 *     .quorum(2)
 *     .build();
 * </pre>
 *
 * @param grants Identity별 초기 역할
 * @param owners 초기 Owner 집합 (1명 이상)
 * @param quorum 초기 정족수 (1 ≤ quorum ≤ owners)
 *
 * @author Pharbit Ledger Team
 * @since 1.0.0
 */
public record LedgerGenesis(
    Map<Identity, Set<Role>> grants,
    Set<Identity> owners,
    int quorum
) {

    public LedgerGenesis {
        if (grants == null || owners == null) {
            throw new IllegalArgumentException("grants and owners cannot be null");
        }
        if (owners.isEmpty()) {
            throw new IllegalArgumentException("owners cannot be empty");
        }
        if (quorum < 1 || quorum > owners.size()) {
            throw new IllegalArgumentException(
                "quorum must be within 1.." + owners.size() + " (current: " + quorum + ")"
            );
        }
        Map<Identity, Set<Role>> copy = new LinkedHashMap<>();
        grants.forEach((identity, roles) -> copy.put(identity, Collections.unmodifiableSet(roleSet(roles))));
        grants = Collections.unmodifiableMap(copy);
        owners = Collections.unmodifiableSet(new LinkedHashSet<>(owners));
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Genesis를 저장소 변경 목록으로 변환.
     *
     * <p>Owner에게는 GOVERNANCE_OWNER 역할이 자동으로 추가됩니다.</p>
     */
    public List<StateChange> toChanges() {
        Map<Identity, Set<Role>> merged = new LinkedHashMap<>();
        grants.forEach((identity, roles) -> merged.put(identity, roleSet(roles)));
        for (Identity owner : owners) {
            merged.computeIfAbsent(owner, ignored -> EnumSet.noneOf(Role.class)).add(Role.GOVERNANCE_OWNER);
        }

        List<StateChange> changes = new ArrayList<>();
        merged.forEach((identity, roles) -> changes.add(new StateChange.PutRoles(identity, roles)));
        changes.add(new StateChange.PutGovernance(new GovernanceState(owners, quorum, 0)));
        return changes;
    }

    private static Set<Role> roleSet(Set<Role> roles) {
        return roles.isEmpty() ? EnumSet.noneOf(Role.class) : EnumSet.copyOf(roles);
    }

    public static final class Builder {

        private final Map<Identity, Set<Role>> grants = new LinkedHashMap<>();
        private final Set<Identity> owners = new LinkedHashSet<>();
        private int quorum = 1;

        private Builder() {
        }

        public Builder grant(Identity identity, Role... roles) {
            Set<Role> held = grants.computeIfAbsent(identity, ignored -> EnumSet.noneOf(Role.class));
            Collections.addAll(held, roles);
            return this;
        }

        public Builder owner(Identity owner) {
            owners.add(owner);
            return this;
        }

        public Builder quorum(int quorum) {
            this.quorum = quorum;
            return this;
        }

        public LedgerGenesis build() {
            return new LedgerGenesis(grants, owners, quorum);
        }
    }
}
