// model/LookupEntry.java
package com.siva.lookup.model;

import lombok.*;

import java.util.Date;

/**
 * One row of a lookup table. Created the first time a name is requested and never renamed.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LookupEntry {

  private String table;

  /** Assigned by the store, unique within {@link #table}. */
  private int id;

  /** Unique within {@link #table}; uniqueness is enforced by the store. */
  private String name;

  @Builder.Default
  private Date createdAt = new Date();
}
