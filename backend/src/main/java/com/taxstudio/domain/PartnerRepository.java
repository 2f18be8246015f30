package com.taxstudio.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

/**
 * Read-only access to user and global partners.
 */
public interface PartnerRepository extends MongoRepository<Partner, String> {
}
