package io.taulite.server.dto;

import java.util.List;

/** JSON body for POST /groups/{label} and POST /groups/{label}/append: series labels in order. */
public class GroupRequest {
    public List<String> series;
}
