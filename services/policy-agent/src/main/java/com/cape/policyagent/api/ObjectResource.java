package com.cape.policyagent.api;

import com.cape.policyagent.domain.ObjectLabels;

/** An object as returned by the API. */
public record ObjectResource(String uuid, LevelResource level) {

    static ObjectResource from(ObjectLabels object) {
        return new ObjectResource(
                object.uuid(), new LevelResource(object.tokens(), object.groups()));
    }
}
