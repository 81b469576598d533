package io.b2mash.lms.multitenancy;

import jakarta.persistence.EntityManagerFactory;
import org.springframework.orm.jpa.JpaTransactionManager;
import org.springframework.transaction.TransactionDefinition;

/**
 * JPA transaction manager for tenant databases. It is detached from the directory {@code
 * DataSource}: a JPA transaction holds a tenant connection, which must never be exposed to
 * directory queries running in the same thread.
 */
public class TenantTransactionManager extends JpaTransactionManager {

  public TenantTransactionManager(EntityManagerFactory emf) {
    super(emf);
    setDataSource(null);
  }

  /** The base class re-reads the factory's DataSource here, which is the directory pool. */
  @Override
  public void afterPropertiesSet() {
    super.afterPropertiesSet();
    setDataSource(null);
  }

  @Override
  protected void doBegin(Object transaction, TransactionDefinition definition) {
    TenantContext.requireTenantId();
    super.doBegin(transaction, definition);
  }
}
