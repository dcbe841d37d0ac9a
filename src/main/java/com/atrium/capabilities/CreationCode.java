package com.atrium.capabilities;

/**
 * Discriminator identifying a class of simulated object.
 * Used to route object instantiation to the module responsible for it.
 */
public enum CreationCode {
    NONE(0),
    PRIMITIVE(9),
    AVATAR(47),
    GRASS(95),
    NEW_TREE(111),
    PARTICLE_SYSTEM(143),
    TREE(255);
    
    private final int code;
    
    CreationCode(int code) {
        this.code = code;
    }
    
    /**
     * The wire value of this creation code.
     */
    public int code() {
        return code;
    }
}
