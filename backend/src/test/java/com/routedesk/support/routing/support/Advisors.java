package com.routedesk.support.routing.support;

import com.routedesk.support.routing.advisor.AdvisorPort;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.support.DefaultListableBeanFactory;

public final class Advisors {

    private Advisors() {
    }

    /**
     * Provider resolving to the given advisor, or to nothing when {@code advisor} is null.
     */
    public static ObjectProvider<AdvisorPort> provider(AdvisorPort advisor) {
        var beanFactory = new DefaultListableBeanFactory();
        if (advisor != null) {
            beanFactory.registerSingleton("advisorPort", advisor);
        }
        return beanFactory.getBeanProvider(AdvisorPort.class);
    }
}
