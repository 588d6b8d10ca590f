package com.netpilot.gateway.permission;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Closed set of resource categories an operation can belong to.
 *
 * The {@link #key()} is the name used in {@code application.yml} under
 * {@code gateway.permissions.categories} and, upper-cased, in environment
 * overrides. Short aliases (e.g. {@code firewall} for
 * {@code firewall_policies}) are accepted wherever a category is parsed from
 * text, so manifests and config files written with either spelling resolve to
 * the same constant.
 */
public enum OperationCategory {

    FIREWALL_POLICIES("firewall_policies", "firewall"),
    QOS_RULES        ("qos_rules",         "qos"),
    VPN_CLIENTS      ("vpn_clients",       "vpn_client"),
    VPN_SERVERS      ("vpn_servers",       "vpn_server"),
    VPN              ("vpn"),
    NETWORKS         ("networks",          "network", "net"),
    WLANS            ("wlans",             "wlan"),
    DEVICES          ("devices",           "device"),
    CLIENTS          ("clients",           "client"),
    GUESTS           ("guests",            "guest"),
    TRAFFIC_ROUTES   ("traffic_routes",    "traffic_route"),
    PORT_FORWARDS    ("port_forwards",     "port_forward"),
    EVENTS           ("events",            "event"),
    VOUCHERS         ("vouchers",          "voucher"),
    USERGROUPS       ("usergroups",        "usergroup"),
    ROUTES           ("routes",            "route"),
    SNMP             ("snmp"),
    STATS            ("stats",             "stat"),
    SYSTEM           ("system");

    // Spring drops '_' from unbracketed map keys, so "trafficroutes" must resolve too.
    private static final Map<String, OperationCategory> BY_NAME = Arrays.stream(values())
            .flatMap(c -> Stream.concat(Stream.of(c.key), c.aliases.stream())
                    .flatMap(name -> Stream.of(name, name.replace("_", "")).distinct())
                    .map(name -> Map.entry(name, c)))
            .collect(Collectors.toUnmodifiableMap(Map.Entry::getKey, Map.Entry::getValue));

    private final String       key;
    private final List<String> aliases;

    OperationCategory(String key, String... aliases) {
        this.key     = key;
        this.aliases = List.of(aliases);
    }

    /** Canonical config key, e.g. {@code "traffic_routes"}. */
    public String key() {
        return key;
    }

    /**
     * Parse a category from its config key or one of its aliases.
     *
     * @throws IllegalArgumentException for an unknown name, so typos in a
     *         manifest or config file fail at startup rather than at dispatch
     */
    public static OperationCategory fromKey(String name) {
        if (name == null) {
            throw new IllegalArgumentException("Operation category must not be null");
        }
        OperationCategory category = BY_NAME.get(name.trim().toLowerCase(Locale.ROOT).replace('-', '_'));
        if (category == null) {
            throw new IllegalArgumentException("Unknown operation category: '" + name
                    + "'. Known categories: " + Arrays.stream(values())
                            .map(OperationCategory::key).toList());
        }
        return category;
    }
}
