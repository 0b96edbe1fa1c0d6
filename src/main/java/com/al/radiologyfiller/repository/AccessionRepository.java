package com.al.radiologyfiller.repository;

import com.al.radiologyfiller.model.Accession;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface AccessionRepository extends MongoRepository<Accession, String>, AccessionRepositoryCustom {

    Optional<Accession> findByAccessionNumber(String accessionNumber);

    boolean existsByAccessionNumber(String accessionNumber);
}
