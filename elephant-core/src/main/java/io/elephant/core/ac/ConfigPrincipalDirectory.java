package io.elephant.core.ac;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.inject.Inject;
import io.elephant.core.config.Config;
import io.elephant.spi.ac.PrincipalDirectory;

/**
 * PrincipalDirectory defined by the system config.
 *
 * <pre>
 * principal.etl.members = alice, reporting
 * principal.reporting.members = bob
 * </pre>
 *
 * With the above, bob is a member of reporting and etl. A principal exists if
 * it has a members entry or is listed as a member of another principal.
 */
public class ConfigPrincipalDirectory
        implements PrincipalDirectory
{
    private static final String KEY_PREFIX = "principal.";
    private static final String KEY_SUFFIX = ".members";

    // principal name -> direct members
    private final Map<String, Set<String>> members;
    private final Set<String> principals;

    @Inject
    public ConfigPrincipalDirectory(Config systemConfig)
    {
        ImmutableMap.Builder<String, Set<String>> members = ImmutableMap.builder();
        ImmutableSet.Builder<String> principals = ImmutableSet.builder();
        for (String key : systemConfig.getKeys()) {
            if (key.startsWith(KEY_PREFIX) && key.endsWith(KEY_SUFFIX)
                    && key.length() > KEY_PREFIX.length() + KEY_SUFFIX.length()) {
                String name = key.substring(KEY_PREFIX.length(), key.length() - KEY_SUFFIX.length());
                List<String> list = systemConfig.getListOrEmpty(key);
                members.put(name, ImmutableSet.copyOf(list));
                principals.add(name);
                principals.addAll(list);
            }
        }
        this.members = members.build();
        this.principals = principals.build();
    }

    @Override
    public boolean exists(String principalName)
    {
        return principals.contains(principalName);
    }

    @Override
    public boolean isMember(String caller, String principalName)
    {
        if (caller.equals(principalName)) {
            return true;
        }
        // walk down from principalName. visited stops cycles.
        Set<String> visited = new HashSet<>();
        Deque<String> queue = new ArrayDeque<>();
        queue.add(principalName);
        while (!queue.isEmpty()) {
            String group = queue.poll();
            if (!visited.add(group)) {
                continue;
            }
            for (String member : members.getOrDefault(group, ImmutableSet.of())) {
                if (member.equals(caller)) {
                    return true;
                }
                queue.add(member);
            }
        }
        return false;
    }
}
