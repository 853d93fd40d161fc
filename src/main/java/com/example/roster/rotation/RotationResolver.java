package com.example.roster.rotation;

import com.example.roster.config.RosterSettings;
import com.example.roster.exception.RosterConfigurationException;
import com.example.roster.person.Person;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.*;

/**
 * Picks each person's cycle: per-run override, then the team's rotation, then the system default.
 */
@Component
public class RotationResolver {

    private static final Logger logger = LoggerFactory.getLogger(RotationResolver.class);

    private final RotationConfig defaultRotation;

    @Autowired
    public RotationResolver(RosterSettings settings) {
        this(new RotationConfig(settings.getDefaultDaysBase(), settings.getDefaultDaysHome()));
    }

    public RotationResolver(RotationConfig defaultRotation) {
        this.defaultRotation = defaultRotation;
    }

    public Map<String, RotationConfig> resolve(List<Person> people,
                                               List<TeamRotation> teamRotations,
                                               RotationConfig customRotation) {
        if (customRotation != null && !customRotation.isValid()) {
            throw new RosterConfigurationException(RosterConfigurationException.INVALID_ROTATION,
                    "Custom rotation must have at least one base day and no negative home days: "
                            + customRotation.daysBase() + "/" + customRotation.daysHome(),
                    customRotation.daysBase(), customRotation.daysHome());
        }

        Map<String, RotationConfig> byTeam = new HashMap<>();
        for (TeamRotation r : Optional.ofNullable(teamRotations).orElse(List.of())) {
            if (r == null || r.teamId() == null) {
                continue;
            }
            RotationConfig cfg = r.toConfig();
            if (!cfg.isValid()) {
                logger.warn("Ignoring invalid rotation {}/{} for team {}", r.daysOnBase(), r.daysAtHome(), r.teamId());
                continue;
            }
            byTeam.putIfAbsent(r.teamId(), cfg);
        }

        Map<String, RotationConfig> result = new LinkedHashMap<>();
        for (Person p : people) {
            RotationConfig cfg;
            if (customRotation != null) {
                cfg = customRotation;
            } else if (p.teamId() != null && byTeam.containsKey(p.teamId())) {
                cfg = byTeam.get(p.teamId());
            } else {
                cfg = requireDefault(p);
            }
            result.put(p.id(), cfg);
        }
        return result;
    }

    private RotationConfig requireDefault(Person person) {
        if (defaultRotation == null || !defaultRotation.isValid()) {
            throw new RosterConfigurationException(RosterConfigurationException.MISSING_ROTATION,
                    "No rotation configured for " + person.displayName() + " and no valid default rotation",
                    person.id());
        }
        return defaultRotation;
    }
}
