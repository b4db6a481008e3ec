package io.taulite.server.dto;

import java.util.List;

/** JSON body for POST /series/{label} and POST /series/{label}/append. */
public class DeltasRequest {
    public List<DeltaRequest> deltas;
}
