package io.taulite.server.dto;

/** JSON body for POST /lenses/{label}/compose. */
public class ComposeRequest {
    public String inputsFrom;
    public String expressionFrom;
}
