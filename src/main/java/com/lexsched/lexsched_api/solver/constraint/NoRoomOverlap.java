package com.lexsched.lexsched_api.solver.constraint;

import java.util.stream.Collectors;

import com.lexsched.lexsched_api.model.Room;
import com.lexsched.lexsched_api.solver.domain.KeyPredicate;
import com.lexsched.lexsched_api.solver.domain.KeyPredicates;
import com.lexsched.lexsched_api.solver.model.ModelContext;

public class NoRoomOverlap extends OverlapConstraint {

    @Override
    public String getName() {
        return "NoRoomOverlap";
    }

    @Override
    protected String rowPrefix() {
        return "room_overlap";
    }

    @Override
    protected Iterable<String> resources(ModelContext context) {
        return context.catalog().rooms().stream().map(Room::getId).collect(Collectors.toList());
    }

    @Override
    protected KeyPredicate ofResource(ModelContext context, String roomId) {
        return KeyPredicates.room(roomId);
    }
}
