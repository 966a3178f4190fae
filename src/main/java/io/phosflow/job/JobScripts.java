package io.phosflow.job;

import io.phosflow.config.PipelineSettings;

/**
 * Slurm batch scripts. Each script touches {@code job.done} in the submit directory when the
 * program exits with status zero; that file is the completion contract read back by the probe.
 */
final class JobScripts {
    private JobScripts() {
    }

    static String render(PreparedJob job, PipelineSettings settings) {
        return switch (job.kind()) {
            case GAUSSIAN -> gaussian(job, settings);
            case ORCA -> orca(job, settings);
            case MOMAP -> momap(job, settings);
        };
    }

    private static String gaussian(PreparedJob job, PipelineSettings s) {
        return """
                #!/bin/bash
                #SBATCH --output="%%j.err"
                #SBATCH --job-name="%1$s"
                #SBATCH --nodes=1
                #SBATCH --ntasks-per-node=%2$d
                #SBATCH -n %2$d
                #SBATCH -p %3$s
                #SBATCH --exclusive

                export jobname="%4$s"
                job_base=${jobname%%.*}
                ulimit -s unlimited

                export TMP_WORKDIR=%5$s/${USER}_${SLURM_JOB_ID}
                export GAUSS_SCRDIR=${TMP_WORKDIR}/g16_tmp
                mkdir -p "$GAUSS_SCRDIR"

                cp "$SLURM_SUBMIT_DIR/$jobname" "$TMP_WORKDIR/"
                if [ -f "$SLURM_SUBMIT_DIR/$job_base.chk" ]; then
                    cp "$SLURM_SUBMIT_DIR/$job_base.chk" "$TMP_WORKDIR/"
                fi

                module load %6$s
                cd "$TMP_WORKDIR"
                g16 "$jobname"
                run_status=$?

                if [ $run_status -eq 0 ] && [ -f "$job_base.chk" ]; then
                    formchk "$job_base.chk" "$job_base.fchk"
                fi

                find . -maxdepth 1 -type f ! -name "*.slurm" ! -name "*.err" -exec cp {} "$SLURM_SUBMIT_DIR/" \\;

                if [ $run_status -eq 0 ]; then
                    touch "$SLURM_SUBMIT_DIR/job.done"
                fi
                rm -rf "$TMP_WORKDIR"
                """.formatted(job.jobName(), s.nproc(), s.partition(), job.inputFile(), s.scratchRoot(), s.gaussianModule());
    }

    private static String orca(PreparedJob job, PipelineSettings s) {
        return """
                #!/bin/bash
                #SBATCH --output="%%j.err"
                #SBATCH --job-name="%1$s"
                #SBATCH --nodes=1
                #SBATCH --ntasks-per-node=%2$d
                #SBATCH -n %2$d
                #SBATCH -p %3$s
                #SBATCH --exclusive

                INPUT=%4$s
                ulimit -s unlimited

                export PATH=$PATH:%5$s/bin:%6$s
                export LD_LIBRARY_PATH=$LD_LIBRARY_PATH:%5$s/lib:%6$s

                SCRDIR=%7$s/${USER}_${SLURM_JOB_ID}
                mkdir -p "$SCRDIR"
                cp "$SLURM_SUBMIT_DIR"/* "$SCRDIR/"
                cd "$SCRDIR"

                sed -i "1i end" ${INPUT}.inp
                sed -i "1i %%pal nprocs %2$d" ${INPUT}.inp

                %6$s/orca ${INPUT}.inp > ${INPUT}.out
                run_status=$?

                rm -f "$SCRDIR/${INPUT}.inp"
                mv "$SCRDIR"/* "$SLURM_SUBMIT_DIR/"

                if [ $run_status -eq 0 ]; then
                    touch "$SLURM_SUBMIT_DIR/job.done"
                fi
                rm -rf "$SCRDIR"
                """.formatted(job.jobName(), s.nproc(), s.partition(), stripExtension(job.inputFile()),
                s.mpiHome(), s.orcaHome(), s.scratchRoot());
    }

    private static String momap(PreparedJob job, PipelineSettings s) {
        return """
                #!/bin/bash
                #SBATCH --time=1000:00:00
                #SBATCH --job-name="%1$s"
                #SBATCH --output="momap.err"
                #SBATCH --nodes=1
                #SBATCH --ntasks-per-node=%2$d
                #SBATCH -n %2$d
                #SBATCH -p %3$s
                #SBATCH --exclusive

                source %4$s
                srun hostname -s | sort -n > hosts

                momap.py -i %5$s -n %2$d -f hosts

                if [ $? -eq 0 ]; then
                    touch job.done
                fi
                """.formatted(job.jobName(), s.nproc(), s.partition(), s.momapEnv(), job.inputFile());
    }

    private static String stripExtension(String fileName) {
        int dot = fileName.lastIndexOf('.');
        return dot < 0 ? fileName : fileName.substring(0, dot);
    }
}
