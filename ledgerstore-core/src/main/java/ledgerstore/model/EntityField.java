package ledgerstore.model;

/**
 * A persisted field of a versioned entity.
 */
public interface EntityField {

  /**
   * Column that stores this field.
   */
  String column();

  /**
   * Whether the field may change after creation. Identity fields are immutable.
   */
  boolean mutable();
}
