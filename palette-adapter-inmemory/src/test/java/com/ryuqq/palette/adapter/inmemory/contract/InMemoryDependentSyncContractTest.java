package com.ryuqq.palette.adapter.inmemory.contract;

import com.ryuqq.palette.testkit.contract.DependentSyncContractTest;
import com.ryuqq.palette.testkit.contract.HostFixture;

/**
 * Runs the render descriptor synchronization contract against the in-memory host.
 *
 * @author Palette Team
 * @since 1.0.0
 */
class InMemoryDependentSyncContractTest extends DependentSyncContractTest {

    @Override
    protected HostFixture createFixture() {
        return new InMemoryHostFixture();
    }
}
