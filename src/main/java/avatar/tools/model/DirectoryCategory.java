package avatar.tools.model;

/**
 * Directory category used only to decide discovery eligibility.
 */
public enum DirectoryCategory {
    ORDINARY,
    APPLICATION,
    GUEST_PAYLOAD
}
