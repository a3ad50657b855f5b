package com.pagesmith.orchestrator.hosting;

/**
 * Repository creation was refused because the name is already taken.
 */
public class NameCollisionException extends HostingException {

    private final String name;

    public NameCollisionException(String name, String detail) {
        super("Repository name already exists: " + name + " (" + detail + ")", 422, false);
        this.name = name;
    }

    public String getName() { return name; }
}
