package com.guard.service.api;

import com.guard.model.ApiChange;
import com.guard.model.SpecPair;

import java.util.List;

public interface DiffEngine {

    /**
     * Compares the candidate of a pair against its baseline.
     *
     * @param pair The resolved baseline and candidate.
     * @return Every structural change found, in endpoint order.
     */
    List<ApiChange> diff(SpecPair pair);
}
