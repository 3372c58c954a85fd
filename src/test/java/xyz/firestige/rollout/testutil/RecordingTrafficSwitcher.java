package xyz.firestige.rollout.testutil;

import xyz.firestige.rollout.domain.port.DeployResult;
import xyz.firestige.rollout.domain.port.TrafficSlot;
import xyz.firestige.rollout.domain.port.TrafficSwitcher;
import xyz.firestige.rollout.domain.target.Target;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

public class RecordingTrafficSwitcher implements TrafficSwitcher {

    public record Route(String targetId, TrafficSlot slot) {
    }

    private final List<Route> routes = new ArrayList<>();
    private final Set<String> failing = ConcurrentHashMap.newKeySet();

    public RecordingTrafficSwitcher failOn(String targetId, TrafficSlot slot) {
        failing.add(targetId + "->" + slot);
        return this;
    }

    @Override
    public DeployResult route(Target target, TrafficSlot slot) {
        synchronized (routes) {
            routes.add(new Route(target.id().getValue(), slot));
        }
        if (failing.contains(target.id().getValue() + "->" + slot)) {
            return DeployResult.failure("模拟切流失败");
        }
        return DeployResult.success();
    }

    public List<Route> getRoutes() {
        synchronized (routes) {
            return List.copyOf(routes);
        }
    }

    public List<String> targetsRoutedTo(TrafficSlot slot) {
        return getRoutes().stream().filter(r -> r.slot() == slot).map(Route::targetId).toList();
    }
}
