package pxefleet.runner.service;

import pxefleet.runner.model.Host;
import pxefleet.runner.model.ValidationException;
import pxefleet.runner.repository.HostRepository;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Turns host, group or room selectors into concrete host records.
 * Exactly one selector must be given; an unknown reference or an empty
 * selection is a validation error.
 */
public class TargetResolver {

    private final HostRepository hosts;

    public TargetResolver(HostRepository hosts) {
        this.hosts = hosts;
    }

    public List<Host> resolve(OperationRequest request) {
        int selectors = (request.targetHosts() != null && !request.targetHosts().isEmpty() ? 1 : 0)
                + (isSet(request.targetGroup()) ? 1 : 0)
                + (isSet(request.targetRoom()) ? 1 : 0);
        if (selectors == 0) {
            throw new ValidationException("One of targetHosts, targetGroup or targetRoom is required");
        }
        if (selectors > 1) {
            throw new ValidationException("Only one of targetHosts, targetGroup or targetRoom may be given");
        }

        if (isSet(request.targetGroup())) {
            return nonEmpty(hosts.findByGroup(request.targetGroup()), "group", request.targetGroup());
        }
        if (isSet(request.targetRoom())) {
            return nonEmpty(hosts.findByRoom(request.targetRoom()), "room", request.targetRoom());
        }
        return byIds(request.targetHosts());
    }

    /** Resolve host ids, keeping the given order and dropping duplicates. */
    public List<Host> byIds(List<String> hostIds) {
        Set<String> unique = new LinkedHashSet<>(hostIds);
        Map<String, Host> found = hosts.findByIds(unique).stream()
                .collect(Collectors.toMap(Host::id, Function.identity()));

        List<String> missing = unique.stream().filter(id -> !found.containsKey(id)).toList();
        if (!missing.isEmpty()) {
            throw new ValidationException("Unknown hosts: " + String.join(", ", missing));
        }

        List<Host> result = new ArrayList<>();
        for (String id : unique) {
            result.add(found.get(id));
        }
        return result;
    }

    /** Hosts among the given ids that still exist, in the given order. */
    public List<Host> existing(List<String> hostIds) {
        Set<String> unique = new LinkedHashSet<>(hostIds);
        Map<String, Host> found = hosts.findByIds(unique).stream()
                .collect(Collectors.toMap(Host::id, Function.identity()));
        return unique.stream().filter(found::containsKey).map(found::get).toList();
    }

    private static List<Host> nonEmpty(List<Host> found, String kind, String name) {
        if (found.isEmpty()) {
            throw new ValidationException("No hosts in " + kind + " '" + name + "'");
        }
        return found;
    }

    private static boolean isSet(String value) {
        return value != null && !value.isBlank();
    }
}
